package com.storefront.identitysync.domain.valueobject;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Idempotence markers kept under {@code computed.flags}.
 * <p>
 * Each flag maps to the instant it was written. Flags are owned by the sync
 * scheduler and worker; signal computation only carries them through.
 * </p>
 */
public final class SyncFlags {

    private static final SyncFlags EMPTY = new SyncFlags(Collections.emptyMap());

    private final Map<String, Instant> flags;

    private SyncFlags(Map<String, Instant> flags) {
        this.flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public static SyncFlags empty() {
        return EMPTY;
    }

    public static SyncFlags of(Map<String, Instant> flags) {
        return flags == null || flags.isEmpty() ? EMPTY : new SyncFlags(flags);
    }

    /**
     * Reads the JSON form. Legacy boolean {@code true} values are accepted and
     * mapped to {@link Instant#EPOCH}.
     */
    public static SyncFlags fromJson(Object raw) {
        if (!(raw instanceof Map)) {
            return EMPTY;
        }
        Map<String, Instant> parsed = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String) {
                try {
                    parsed.put(String.valueOf(entry.getKey()), Instant.parse((String) value));
                } catch (RuntimeException e) {
                    parsed.put(String.valueOf(entry.getKey()), Instant.EPOCH);
                }
            } else if (Boolean.TRUE.equals(value)) {
                parsed.put(String.valueOf(entry.getKey()), Instant.EPOCH);
            }
        }
        return of(parsed);
    }

    public boolean isSet(String flag) {
        return flags.containsKey(flag);
    }

    public Instant setAt(String flag) {
        return flags.get(flag);
    }

    public SyncFlags with(String flag, Instant at) {
        if (flag == null || at == null) {
            throw new IllegalArgumentException("flag and timestamp are required");
        }
        Map<String, Instant> copy = new LinkedHashMap<>(flags);
        copy.put(flag, at);
        return new SyncFlags(copy);
    }

    public SyncFlags without(Collection<String> names) {
        Map<String, Instant> copy = new LinkedHashMap<>(flags);
        names.forEach(copy::remove);
        return of(copy);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        flags.forEach((name, at) -> json.put(name, at.toString()));
        return json;
    }

    public Map<String, Instant> asMap() {
        return flags;
    }

    public boolean isEmpty() {
        return flags.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return flags.equals(((SyncFlags) o).flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(flags);
    }

    @Override
    public String toString() {
        return "SyncFlags" + flags.keySet();
    }
}
