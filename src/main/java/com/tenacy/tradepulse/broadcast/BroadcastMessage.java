package com.tenacy.tradepulse.broadcast;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Server to client frame: {@code {type, data, timestamp}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastMessage {

    public static final String CONNECTED = "connected";
    public static final String HEALTH = "health";
    public static final String METRICS = "metrics";
    public static final String PONG = "pong";

    private String type;
    private Object data;
    private Instant timestamp;
}
