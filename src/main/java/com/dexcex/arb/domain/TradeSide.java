package com.dexcex.arb.domain;

public enum TradeSide {
    BUY, SELL
}
