package com.dexcex.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class PriceSample {
    String exchange;
    VenueKind venueKind;
    String asset;
    BigDecimal price;
    Instant sampledAt;
}
