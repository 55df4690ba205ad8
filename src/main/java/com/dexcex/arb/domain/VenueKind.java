package com.dexcex.arb.domain;

public enum VenueKind {
    DEX, // on-chain AMM, higher fees and gas
    CEX
}
