package com.dexcex.arb.core;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.VenueKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class FeeModelTest {

    private final FeeModel feeModel = new FeeModel(new ArbitrageProperties());

    @Test
    void spreadDeductsBothFees() {
        FeeModel.Spread spread = feeModel.spread(new BigDecimal("100"), VenueKind.DEX, new BigDecimal("101"),
                VenueKind.CEX);

        assertEquals(0, new BigDecimal("1").compareTo(spread.getGrossSpread()));
        assertEquals(0, new BigDecimal("0.3").compareTo(spread.getBuyFee()));
        assertEquals(0, new BigDecimal("0.101").compareTo(spread.getSellFee()));
        assertEquals(0, new BigDecimal("0.599").compareTo(spread.getNetProfit()));
        assertEquals(0, new BigDecimal("0.599").compareTo(spread.getNetProfitPercentage()));
    }

    @Test
    void nonPositiveBuyPriceHasNoSpread() {
        assertNull(feeModel.spread(BigDecimal.ZERO, VenueKind.CEX, BigDecimal.TEN, VenueKind.CEX));
        assertNull(feeModel.spread(new BigDecimal("-1"), VenueKind.CEX, BigDecimal.TEN, VenueKind.CEX));
        assertNull(feeModel.spread(null, VenueKind.CEX, BigDecimal.TEN, VenueKind.CEX));
    }

    @Test
    void gasIsChargedPerDexLeg() {
        assertEquals(0, BigDecimal.ZERO.compareTo(feeModel.gasCost(VenueKind.CEX, VenueKind.CEX)));
        assertEquals(0, new BigDecimal("15").compareTo(feeModel.gasCost(VenueKind.DEX, VenueKind.CEX)));
        assertEquals(0, new BigDecimal("30").compareTo(feeModel.gasCost(VenueKind.DEX, VenueKind.DEX)));
    }
}
