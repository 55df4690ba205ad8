package com.dexcex.arb.core;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.ArbitrageOpportunity;
import com.dexcex.arb.domain.ArbitrageRoute;
import com.dexcex.arb.domain.TradeSide;
import com.dexcex.arb.domain.VenueKind;
import com.dexcex.arb.infra.InMemoryOpportunityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class OpportunityStoreSyncTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryOpportunityStore store;
    private OpportunityStoreSync sync;

    @BeforeEach
    void setUp() {
        store = new InMemoryOpportunityStore();
        sync = new OpportunityStoreSync(store, new ArbitrageProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createsOneActiveOpportunityPerRoute() {
        OpportunityStoreSync.SyncResult result = sync.sync(List.of(
                route("ETH", "X", "Y", "3200", "3215", "0.268"),
                route("BTC", "X", "Y", "65000", "65400", "0.41")));

        assertEquals(2, result.getCreated());
        List<ArbitrageOpportunity> stored = store.listOpportunities();
        assertEquals(2, stored.size());
        assertTrue(stored.stream().allMatch(ArbitrageOpportunity::isActive));

        ArbitrageOpportunity eth = stored.stream().filter(o -> o.getAsset().equals("ETH")).findFirst().orElseThrow();
        assertEquals("X", eth.getBuyExchange());
        assertEquals("Y", eth.getSellExchange());
        assertEquals(0, new BigDecimal("3200").compareTo(eth.getBuyPrice()));
        assertEquals(VenueKind.CEX, eth.getBuyVenueKind());
        assertEquals(NOW, eth.getTimestamp());
    }

    @Test
    void unchangedRoutesMakeNoWrites() {
        List<ArbitrageRoute> routes = List.of(route("ETH", "X", "Y", "3200", "3215", "0.268"));
        sync.sync(routes);

        OpportunityStoreSync.SyncResult second = sync.sync(List.of(route("ETH", "X", "Y", "3200", "3215", "0.268")));

        assertEquals(0, second.writes());
        assertEquals(1, store.listOpportunities().size());
    }

    @Test
    void smallProfitDriftWithSamePricesIsIgnored() {
        sync.sync(List.of(route("ETH", "X", "Y", "3200", "3215", "0.268")));

        OpportunityStoreSync.SyncResult result = sync.sync(List.of(route("ETH", "X", "Y", "3200", "3215", "0.30")));

        assertEquals(0, result.writes());
        assertEquals(0, new BigDecimal("0.268").compareTo(store.listOpportunities().get(0).getProfitPercentage()));
    }

    @Test
    void changedPricesUpdateInPlace() {
        sync.sync(List.of(route("ETH", "X", "Y", "3200", "3215", "0.268")));
        long id = store.listOpportunities().get(0).getId();

        OpportunityStoreSync.SyncResult result = sync.sync(List.of(route("ETH", "X", "Y", "3190", "3215", "0.58")));

        assertEquals(1, result.getUpdated());
        assertEquals(0, result.getCreated());
        ArbitrageOpportunity updated = store.getOpportunity(id).orElseThrow();
        assertEquals(0, new BigDecimal("3190").compareTo(updated.getBuyPrice()));
        assertEquals(0, new BigDecimal("0.58").compareTo(updated.getProfitPercentage()));
        assertEquals(ArbitrageOpportunity.Status.ACTIVE, updated.getStatus());
    }

    @Test
    void vanishedRouteIsDeactivatedAndLaterRecreated() {
        sync.sync(List.of(route("ETH", "X", "Y", "3200", "3215", "0.268")));
        long firstId = store.listOpportunities().get(0).getId();

        OpportunityStoreSync.SyncResult gone = sync.sync(List.of());
        assertEquals(1, gone.getDeactivated());
        assertEquals(ArbitrageOpportunity.Status.INACTIVE, store.getOpportunity(firstId).orElseThrow().getStatus());

        OpportunityStoreSync.SyncResult back = sync.sync(List.of(route("ETH", "X", "Y", "3200", "3215", "0.268")));
        assertEquals(1, back.getCreated());
        assertEquals(2, store.listOpportunities().size());
        assertEquals(1, store.listOpportunities().stream().filter(ArbitrageOpportunity::isActive).count());
    }

    @Test
    void executingAndExecutedOpportunitiesAreLeftAlone() {
        sync.sync(List.of(
                route("ETH", "X", "Y", "3200", "3215", "0.268"),
                route("BTC", "X", "Y", "65000", "65400", "0.41")));
        long eth = findId("ETH");
        long btc = findId("BTC");
        assertTrue(store.compareAndSetStatus(eth, ArbitrageOpportunity.Status.ACTIVE,
                ArbitrageOpportunity.Status.EXECUTING));
        assertTrue(store.compareAndSetStatus(btc, ArbitrageOpportunity.Status.ACTIVE,
                ArbitrageOpportunity.Status.EXECUTED));

        OpportunityStoreSync.SyncResult result = sync.sync(List.of());

        assertEquals(0, result.writes());
        assertEquals(ArbitrageOpportunity.Status.EXECUTING, store.getOpportunity(eth).orElseThrow().getStatus());
        assertEquals(ArbitrageOpportunity.Status.EXECUTED, store.getOpportunity(btc).orElseThrow().getStatus());
    }

    @Test
    void executingTripleGetsNoSecondRow() {
        List<ArbitrageRoute> routes = List.of(route("ETH", "X", "Y", "3200", "3215", "0.268"));
        sync.sync(routes);
        long id = store.listOpportunities().get(0).getId();
        store.compareAndSetStatus(id, ArbitrageOpportunity.Status.ACTIVE, ArbitrageOpportunity.Status.EXECUTING);

        OpportunityStoreSync.SyncResult result = sync.sync(List.of(route("ETH", "X", "Y", "3190", "3215", "0.58")));

        assertEquals(0, result.writes());
        assertEquals(1, store.listOpportunities().size());
        assertEquals(0, new BigDecimal("3200").compareTo(store.getOpportunity(id).orElseThrow().getBuyPrice()));
    }

    @Test
    void rowSettledAfterListingIsNotOverwritten() {
        sync.sync(List.of(route("ETH", "X", "Y", "3200", "3215", "0.268")));
        long id = store.listOpportunities().get(0).getId();
        SettlingStore settling = new SettlingStore(store, id);
        OpportunityStoreSync racingSync = new OpportunityStoreSync(settling, new ArbitrageProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        OpportunityStoreSync.SyncResult result = racingSync.sync(
                List.of(route("ETH", "X", "Y", "3100", "3215", "3.5")));

        assertEquals(0, result.getUpdated());
        assertEquals(0, result.getCreated());
        ArbitrageOpportunity row = store.getOpportunity(id).orElseThrow();
        assertEquals(ArbitrageOpportunity.Status.EXECUTED, row.getStatus());
        assertEquals(0, new BigDecimal("3200").compareTo(row.getBuyPrice()));
        assertEquals(0, new BigDecimal("0.268").compareTo(row.getProfitPercentage()));
    }

    @Test
    void duplicateRoutesInOneTickCreateOnce() {
        OpportunityStoreSync.SyncResult result = sync.sync(List.of(
                route("ETH", "X", "Y", "3200", "3215", "0.268"),
                route("ETH", "X", "Y", "3200", "3215", "0.268")));

        assertEquals(1, result.getCreated());
        assertEquals(1, store.listOpportunities().size());
    }

    @Test
    void toleranceIsStrict() {
        BigDecimal tolerance = new BigDecimal("0.1");
        assertTrue(OpportunityStoreSync.withinTolerance(new BigDecimal("0.30"), new BigDecimal("0.35"), tolerance));
        assertFalse(OpportunityStoreSync.withinTolerance(new BigDecimal("0.30"), new BigDecimal("0.40"), tolerance));
        assertFalse(OpportunityStoreSync.withinTolerance(new BigDecimal("0.50"), new BigDecimal("0.30"), tolerance));
    }

    private long findId(String asset) {
        return store.listOpportunities().stream()
                .filter(o -> o.getAsset().equals(asset))
                .findFirst()
                .orElseThrow()
                .getId();
    }

    /**
     * Marks one row EXECUTED right after handing out the listing, as a concurrent
     * execution would.
     */
    private static class SettlingStore implements OpportunityStore {
        private final InMemoryOpportunityStore delegate;
        private final long settledId;

        SettlingStore(InMemoryOpportunityStore delegate, long settledId) {
            this.delegate = delegate;
            this.settledId = settledId;
        }

        @Override
        public Optional<ArbitrageOpportunity> getOpportunity(long id) {
            return delegate.getOpportunity(id);
        }

        @Override
        public List<ArbitrageOpportunity> listOpportunities() {
            List<ArbitrageOpportunity> listed = delegate.listOpportunities();
            delegate.compareAndSetStatus(settledId, ArbitrageOpportunity.Status.ACTIVE,
                    ArbitrageOpportunity.Status.EXECUTED);
            return listed;
        }

        @Override
        public ArbitrageOpportunity createOpportunity(ArbitrageOpportunity data) {
            return delegate.createOpportunity(data);
        }

        @Override
        public Optional<ArbitrageOpportunity> updateOpportunity(long id, UnaryOperator<ArbitrageOpportunity> patch) {
            return delegate.updateOpportunity(id, patch);
        }

        @Override
        public boolean compareAndSetStatus(long id, ArbitrageOpportunity.Status expected,
                ArbitrageOpportunity.Status next) {
            return delegate.compareAndSetStatus(id, expected, next);
        }
    }

    static ArbitrageRoute route(String asset, String buy, String sell, String buyPrice, String sellPrice,
            String pct) {
        return ArbitrageRoute.builder()
                .id(asset + "-" + buy + "-" + sell)
                .asset(asset)
                .buyLeg(ArbitrageRoute.Leg.builder()
                        .exchange(buy)
                        .venueKind(VenueKind.CEX)
                        .side(TradeSide.BUY)
                        .expectedPrice(new BigDecimal(buyPrice))
                        .amount(BigDecimal.ONE)
                        .estimatedFee(BigDecimal.ZERO)
                        .build())
                .sellLeg(ArbitrageRoute.Leg.builder()
                        .exchange(sell)
                        .venueKind(VenueKind.CEX)
                        .side(TradeSide.SELL)
                        .expectedPrice(new BigDecimal(sellPrice))
                        .amount(BigDecimal.ONE)
                        .estimatedFee(BigDecimal.ZERO)
                        .build())
                .estimatedProfitAmount(new BigDecimal(sellPrice).subtract(new BigDecimal(buyPrice)))
                .estimatedProfitPercentage(new BigDecimal(pct))
                .riskScore(40)
                .confidence(0.7)
                .detectedAt(NOW)
                .build();
    }
}
