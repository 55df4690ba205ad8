package com.dexcex.arb.core;

import com.dexcex.arb.domain.ArbitrageRoute;

import java.util.List;

public interface ArbitrageDetector {

    /**
     * Scans the current price snapshot.
     *
     * @return profitable routes, best net percentage first
     */
    List<ArbitrageRoute> detect();
}
