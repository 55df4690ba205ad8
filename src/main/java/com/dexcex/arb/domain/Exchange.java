package com.dexcex.arb.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A monitored venue. Identity and kind are fixed at registration; only the
 * connection status moves, driven by the sampling loop. A venue is
 * {@code DISCONNECTED} until its first successful sample.
 */
@Getter
@ToString
public class Exchange {

    private final String name;
    private final VenueKind kind;
    private final String apiUrl;
    private volatile ConnectionStatus connectionStatus;

    @Builder
    public Exchange(String name, VenueKind kind, String apiUrl) {
        this.name = name;
        this.kind = kind;
        this.apiUrl = apiUrl;
        this.connectionStatus = ConnectionStatus.DISCONNECTED;
    }

    public void markConnected() {
        this.connectionStatus = ConnectionStatus.CONNECTED;
    }

    public void markError() {
        this.connectionStatus = ConnectionStatus.ERROR;
    }

    public enum ConnectionStatus {
        CONNECTED, DISCONNECTED, ERROR
    }
}
