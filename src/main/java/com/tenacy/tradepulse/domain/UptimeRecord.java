package com.tenacy.tradepulse.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * One live record per component, mutated on every poll and never purged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UptimeRecord implements StoredRecord {
    private Long id;
    private String component;
    private long totalUptimeSeconds;
    private Instant lastOnline;
    private Instant lastOffline;
    private int downtimeCount;
    private Boolean online;
    private Instant lastChecked;

    public static UptimeRecord firstSeen(String component, boolean online, Instant now) {
        return UptimeRecord.builder()
                .component(component)
                .totalUptimeSeconds(0)
                .lastOnline(online ? now : null)
                .lastOffline(online ? null : now)
                .downtimeCount(online ? 0 : 1)
                .online(online)
                .lastChecked(now)
                .build();
    }

    /**
     * Applies one poll result. Uptime accrues only between two consecutive online
     * polls; going offline after being online counts as one downtime transition.
     */
    public void recordPoll(boolean nowOnline, Instant now) {
        boolean wasOnline = Boolean.TRUE.equals(online);

        if (nowOnline) {
            if (wasOnline && lastChecked != null && now.isAfter(lastChecked)) {
                totalUptimeSeconds += Duration.between(lastChecked, now).getSeconds();
            }
            lastOnline = now;
        } else {
            if (wasOnline || online == null) {
                downtimeCount++;
            }
            lastOffline = now;
        }

        online = nowOnline;
        lastChecked = now;
    }

    @Override
    @JsonIgnore
    public Instant getTimestamp() {
        return lastChecked;
    }
}
