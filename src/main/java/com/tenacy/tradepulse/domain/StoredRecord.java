package com.tenacy.tradepulse.domain;

import java.time.Instant;

/**
 * Record kept in one of the append-only streams of the event store.
 */
public interface StoredRecord {

    Long getId();

    void setId(Long id);

    Instant getTimestamp();
}
