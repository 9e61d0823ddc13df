package com.tenacy.tradepulse.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;

public enum HealthStatus {
    UNKNOWN(0, -1),
    HEALTHY(1, 2),
    WARNING(2, 1),
    CRITICAL(3, 0);

    // 높을수록 심각
    private final int rank;
    private final int gaugeValue;

    HealthStatus(int rank, int gaugeValue) {
        this.rank = rank;
        this.gaugeValue = gaugeValue;
    }

    public int getGaugeValue() {
        return gaugeValue;
    }

    public boolean isOnline() {
        return this != CRITICAL;
    }

    public HealthStatus worse(HealthStatus other) {
        if (other == null) {
            return this;
        }
        return other.rank > this.rank ? other : this;
    }

    /**
     * Worst status of the given collection. An empty collection is {@link #UNKNOWN}.
     */
    public static HealthStatus worstOf(Collection<HealthStatus> statuses) {
        HealthStatus worst = UNKNOWN;
        for (HealthStatus status : statuses) {
            worst = worst.worse(status);
        }
        return worst;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HealthStatus fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (HealthStatus status : values()) {
            if (status.name().equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
