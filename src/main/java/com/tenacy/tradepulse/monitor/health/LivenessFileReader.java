package com.tenacy.tradepulse.monitor.health;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reads the liveness side-channel file shared by the health and performance monitors.
 */
public class LivenessFileReader {

    private final Path healthFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LivenessFileReader(Path healthFile, ObjectMapper objectMapper, Clock clock) {
        this.healthFile = healthFile;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path getHealthFile() {
        return healthFile;
    }

    public boolean exists() {
        return Files.exists(healthFile);
    }

    /**
     * @throws FileNotFoundException when the agent has not written the file
     * @throws IOException when the file cannot be read or is not valid JSON
     */
    public LivenessReport read() throws IOException {
        if (!Files.exists(healthFile)) {
            throw new FileNotFoundException("Health file not found - agent may not be running");
        }
        return objectMapper.readValue(healthFile.toFile(), LivenessReport.class);
    }

    /**
     * Seconds since the last heartbeat, empty when the report carries none.
     * Timestamps without an offset are read in the clock's zone; numeric values are epoch seconds.
     */
    public Optional<Double> heartbeatAgeSeconds(LivenessReport report) {
        return parseHeartbeat(report.getLastHeartbeat())
                .map(heartbeat -> (clock.millis() - heartbeat.toEpochMilli()) / 1000.0);
    }

    Optional<Instant> parseHeartbeat(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }

        String text = value.trim();
        return tryParse(() -> OffsetDateTime.parse(text).toInstant())
                .or(() -> tryParse(() -> LocalDateTime.parse(text).atZone(clock.getZone()).toInstant()))
                .or(() -> tryParse(() -> Instant.ofEpochMilli(new BigDecimal(text).movePointRight(3).longValue())));
    }

    private static Optional<Instant> tryParse(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException | NumberFormatException e) {
            return Optional.empty();
        }
    }
}
