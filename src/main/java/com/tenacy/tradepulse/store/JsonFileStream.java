package com.tenacy.tradepulse.store;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.tradepulse.domain.StoredRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Append-only record stream backed by a single JSON file.
 * <p>
 * Every mutation rewrites the whole file through a temp file and an atomic move.
 * Writes are serialized per stream; a failed flush is logged and the in-memory
 * state is kept until the next successful flush. Records handed out are detached
 * copies, the stored instances are only touched under the stream lock.
 */
@Slf4j
public class JsonFileStream<T extends StoredRecord> {

    private final String name;
    private final Path file;
    private final int maxRecords;
    private final ObjectMapper objectMapper;
    private final Class<T> recordType;
    private final JavaType listType;

    private final List<T> records = new ArrayList<>();
    private long lastId = 0;

    /**
     * @param maxRecords retention count, {@code 0} or less keeps every record
     */
    public JsonFileStream(String name, Path file, Class<T> recordType, int maxRecords, ObjectMapper objectMapper) {
        this.name = name;
        this.file = file;
        this.maxRecords = maxRecords;
        this.objectMapper = objectMapper;
        this.recordType = recordType;
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, recordType);
    }

    public String getName() {
        return name;
    }

    public synchronized void load() {
        records.clear();
        lastId = 0;

        if (!Files.exists(file)) {
            return;
        }

        try {
            List<T> loaded = objectMapper.readValue(file.toFile(), listType);
            for (T record : loaded) {
                if (record.getId() != null) {
                    lastId = Math.max(lastId, record.getId());
                }
            }
            records.addAll(loaded);
            trim();
            log.debug("Loaded {} records into stream {}", records.size(), name);
        } catch (IOException e) {
            log.error("Failed to load stream {} from {}: {}", name, file, e.getMessage());
        }
    }

    /**
     * Assigns the next id to {@code record} and stores a copy of it.
     */
    public synchronized T append(T record) {
        record.setId(++lastId);
        records.add(copy(record));
        trim();
        flush();
        return record;
    }

    /**
     * Most recent {@code limit} matching records, newest first.
     */
    public synchronized List<T> query(Predicate<? super T> filter, int limit) {
        List<T> result = new ArrayList<>();
        for (int i = records.size() - 1; i >= 0 && result.size() < limit; i--) {
            T record = records.get(i);
            if (filter.test(record)) {
                result.add(copy(record));
            }
        }
        return result;
    }

    public synchronized Optional<T> find(Predicate<? super T> filter) {
        return records.stream().filter(filter).findFirst().map(this::copy);
    }

    public synchronized List<T> findAll() {
        List<T> result = new ArrayList<>(records.size());
        for (T record : records) {
            result.add(copy(record));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Mutates the matching record in place, or appends the created one when none
     * matches, then persists the stream.
     */
    public synchronized T upsert(Predicate<? super T> match, Consumer<T> update, Supplier<T> create) {
        Optional<T> existing = records.stream().filter(match).findFirst();
        if (existing.isPresent()) {
            update.accept(existing.get());
            flush();
            return copy(existing.get());
        }
        return append(create.get());
    }

    public synchronized int purgeOlderThan(Instant cutoff) {
        int before = records.size();
        records.removeIf(r -> r.getTimestamp() != null && r.getTimestamp().isBefore(cutoff));
        int removed = before - records.size();
        flush();
        return removed;
    }

    public synchronized int size() {
        return records.size();
    }

    private T copy(T record) {
        return objectMapper.convertValue(record, recordType);
    }

    private void trim() {
        if (maxRecords <= 0) {
            return;
        }
        int overflow = records.size() - maxRecords;
        if (overflow > 0) {
            records.subList(0, overflow).clear();
        }
    }

    private void flush() {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), records);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to persist stream {} to {}: {}", name, file, e.getMessage());
        }
    }
}
