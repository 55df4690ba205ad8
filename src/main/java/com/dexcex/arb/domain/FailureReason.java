package com.dexcex.arb.domain;

public enum FailureReason {
    NOT_FOUND,
    STALE,
    PRICE_UNAVAILABLE,
    NO_LONGER_PROFITABLE,
    THROTTLED,
    LEG_FAILURE
}
