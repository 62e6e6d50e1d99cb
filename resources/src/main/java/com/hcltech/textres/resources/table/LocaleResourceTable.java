package com.hcltech.textres.resources.table;

import com.hcltech.textres.resources.locale.LocaleKey;
import com.hcltech.textres.resources.parser.ResourceMapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed mappings of one resource group by locale. Never mutated after construction, so it can be read
 * from any number of threads.
 */
public final class LocaleResourceTable {
    private final Map<LocaleKey, ResourceMapping> byLocale;

    public LocaleResourceTable(Map<LocaleKey, ResourceMapping> byLocale) {
        Objects.requireNonNull(byLocale, "byLocale");
        this.byLocale = Collections.unmodifiableMap(new LinkedHashMap<>(byLocale));
    }

    /** The value for {@code key} in exactly {@code locale}, with no fallback. */
    public Optional<String> find(LocaleKey locale, String key) {
        ResourceMapping mapping = byLocale.get(locale);
        return mapping == null ? Optional.empty() : mapping.get(key);
    }

    public Set<LocaleKey> locales() {
        return byLocale.keySet();
    }

    public boolean isEmpty() {
        return byLocale.isEmpty();
    }

    @Override
    public String toString() {
        return "LocaleResourceTable" + byLocale.keySet();
    }
}
