package com.hcltech.textres.resources.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Immutable key to value strings parsed from one resource file. Keeps file order for diagnostics. */
public final class ResourceMapping {
    public static final ResourceMapping EMPTY = new ResourceMapping(Map.of());

    private final Map<String, String> values;

    public ResourceMapping(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public int size() {
        return values.size();
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceMapping)) return false;
        return values.equals(((ResourceMapping) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceMapping" + values;
    }
}
