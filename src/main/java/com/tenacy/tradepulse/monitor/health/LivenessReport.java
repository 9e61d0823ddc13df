package com.tenacy.tradepulse.monitor.health;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Liveness side-channel document written by the trading agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LivenessReport {

    @JsonProperty("is_alive")
    private Boolean alive;

    @JsonProperty("last_heartbeat")
    private String lastHeartbeat;

    @JsonProperty("uptime_seconds")
    private Double uptimeSeconds;

    @JsonProperty("models_loaded")
    private Object modelsLoaded;

    @JsonProperty("circuit_breaker_active")
    private Boolean circuitBreakerActive;

    @JsonProperty("signals_count")
    private Long signalsCount;

    @JsonProperty("trades_count")
    private Long tradesCount;

    @JsonProperty("errors_count")
    private Long errorsCount;

    @JsonProperty("last_signal")
    private Object lastSignal;

    @JsonProperty("last_trade")
    private Object lastTrade;
}
