package com.codesearch.store;

import java.util.Map;
import java.util.Objects;

public record WhereFilter(MetadataField field, Object value) {

    public WhereFilter {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
    }

    public static WhereFilter eq(MetadataField field, Object value) {
        return new WhereFilter(field, value);
    }

    public boolean matches(ChunkMetadata metadata) {
        return metadata != null && value.equals(metadata.value(field));
    }

    public Map<String, Object> toClause() {
        return Map.of(field.key(), Map.of("$eq", value));
    }
}
