package com.labelcheck.backend.services.labels.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.labelcheck.backend.enums.FieldKey;

/**
 * Typed fields found on one label or tag. A key that was not found is simply absent.
 * Holds at most one of {@code upc} / {@code upc_candidate}.
 */
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE)
public final class ExtractedFields {

    private static final ExtractedFields EMPTY = new ExtractedFields(new EnumMap<>(FieldKey.class));

    private final Map<FieldKey, Object> values;

    private ExtractedFields(EnumMap<FieldKey, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ExtractedFields empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    public boolean has(FieldKey key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Optional<String> get(FieldKey key) {
        Object value = values.get(key);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public String getOrEmpty(FieldKey key) {
        return get(key).orElse("");
    }

    @SuppressWarnings("unchecked")
    public List<CompositionEntry> composition() {
        Object value = values.get(FieldKey.COMPOSITION);
        return value == null ? List.of() : (List<CompositionEntry>) value;
    }

    public boolean isExclusiveOfDecoration() {
        return Boolean.TRUE.equals(values.get(FieldKey.EXCLUSIVE_OF_DECORATION));
    }

    @JsonAnyGetter
    public Map<String, Object> asMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((key, value) -> out.put(key.getJsonName(), value));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractedFields other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ExtractedFields" + asMap();
    }

    public static final class Builder {

        private final EnumMap<FieldKey, Object> values = new EnumMap<>(FieldKey.class);

        private Builder() {
        }

        public Builder put(FieldKey key, String value) {
            switch (key) {
                case UPC -> {
                    return upc(value);
                }
                case UPC_CANDIDATE -> {
                    return upcCandidate(value);
                }
                case COMPOSITION, EXCLUSIVE_OF_DECORATION ->
                        throw new IllegalArgumentException(key + " is not a text field");
                default -> {
                }
            }
            if (value != null && !value.isBlank()) {
                values.put(key, value);
            }
            return this;
        }

        public Builder putIfAbsent(FieldKey key, String value) {
            if (!values.containsKey(key)) {
                put(key, value);
            }
            return this;
        }

        /**
         * Checksum-valid code; replaces any candidate held for the same slot.
         */
        public Builder upc(String code) {
            if (code != null && !code.isBlank()) {
                values.remove(FieldKey.UPC_CANDIDATE);
                values.put(FieldKey.UPC, code);
            }
            return this;
        }

        /**
         * Number-shaped code that failed the checksum. Ignored once a valid code is held.
         */
        public Builder upcCandidate(String code) {
            if (code != null && !code.isBlank() && !values.containsKey(FieldKey.UPC)) {
                values.put(FieldKey.UPC_CANDIDATE, code);
            }
            return this;
        }

        public Builder composition(List<CompositionEntry> entries) {
            if (entries != null && !entries.isEmpty()) {
                values.put(FieldKey.COMPOSITION, List.copyOf(new ArrayList<>(entries)));
            }
            return this;
        }

        public Builder exclusiveOfDecoration(boolean flag) {
            if (flag) {
                values.put(FieldKey.EXCLUSIVE_OF_DECORATION, Boolean.TRUE);
            }
            return this;
        }

        public boolean has(FieldKey key) {
            return values.containsKey(key);
        }

        public ExtractedFields build() {
            return new ExtractedFields(new EnumMap<>(values));
        }
    }
}
