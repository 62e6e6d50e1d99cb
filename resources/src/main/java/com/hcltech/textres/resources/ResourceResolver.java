package com.hcltech.textres.resources;

import com.hcltech.textres.resources.config.TextResourcesConfig;
import com.hcltech.textres.resources.locale.InvalidLocaleTagException;
import com.hcltech.textres.resources.locale.LocaleKey;
import com.hcltech.textres.resources.locate.ResourceFileDescriptor;
import com.hcltech.textres.resources.locate.ResourceGroupId;
import com.hcltech.textres.resources.source.ResourceSource;
import com.hcltech.textres.resources.table.LocaleResourceTable;
import com.hcltech.textres.resources.table.LocaleResourceTableBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Looks up localized strings of one resource group.
 * <p>
 * The group's files are located, read and parsed eagerly in the constructor; any failure is thrown from there
 * and no resolver exists. Lookups try the exact locale, then its language-only form, and otherwise answer the
 * empty string; they never throw for unknown keys or locales.
 * <p>
 * {@link #rebind(ResourceGroupId)} loads another group and swaps the whole table in at once, so concurrent
 * readers see either the old group or the new one.
 */
public final class ResourceResolver {
    private static final Logger log = LoggerFactory.getLogger(ResourceResolver.class);

    private final ResourceSource source;
    private final TextResourcesConfig config;
    private final ResourceAccessor accessor;
    private final AtomicReference<Binding> binding = new AtomicReference<>();
    private volatile LocaleKey activeLocale = LocaleKey.INVARIANT;

    public ResourceResolver(ResourceGroupId groupId, ResourceSource source) {
        this(groupId, source, TextResourcesConfig.DEFAULTS, ResourceAccessor.NONE);
    }

    /**
     * @throws com.hcltech.textres.resources.source.MissingResourceFileException if a located file cannot be read
     * @throws com.hcltech.textres.resources.parser.DuplicateKeyException        if a file repeats a key
     * @throws com.hcltech.textres.resources.locale.InvalidLocaleTagException     if a file name has a malformed tag
     * @throws com.hcltech.textres.resources.table.LocaleCollisionException       under the FAIL collision policy
     */
    public ResourceResolver(ResourceGroupId groupId,
                            ResourceSource source,
                            TextResourcesConfig config,
                            ResourceAccessor accessor) {
        this.source = Objects.requireNonNull(source, "source");
        this.config = Objects.requireNonNull(config, "config");
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        rebind(groupId);
    }

    /**
     * Loads {@code groupId} and replaces the current table with it. On failure the previous binding stays.
     */
    public synchronized void rebind(ResourceGroupId groupId) {
        Objects.requireNonNull(groupId, "groupId");
        List<ResourceFileDescriptor> files = config.locator().locate(groupId, source);
        LocaleResourceTable table = LocaleResourceTableBuilder.with(source)
                .parser(config.parser())
                .collisionPolicy(config.collisionPolicy())
                .files(files)
                .build();
        binding.set(new Binding(groupId, table));
        log.info("Bound resource group {} with locales {}", groupId, table.locales());
        accessor.publish(this);
    }

    public String getString(String key) {
        return getString(key, activeLocale);
    }

    public String getString(String key, Locale locale) {
        if (locale == null) return "";
        LocaleKey localeKey;
        try {
            localeKey = LocaleKey.of(locale);
        } catch (InvalidLocaleTagException e) {
            log.debug("No resources can match locale {}: {}", locale, e.getMessage());
            return "";
        }
        return getString(key, localeKey);
    }

    /** Exact locale, then language-only locale, then {@code ""}. */
    public String getString(String key, LocaleKey locale) {
        if (key == null || locale == null) return "";
        LocaleResourceTable table = binding.get().table();
        Optional<String> exact = table.find(locale, key);
        if (exact.isPresent()) return exact.get();
        LocaleKey language = locale.languageOnly();
        if (language.equals(locale)) return "";
        return table.find(language, key).orElse("");
    }

    public LocaleKey activeLocale() {
        return activeLocale;
    }

    /** Sets the locale used by {@link #getString(String)} and forwards it to the accessor. */
    public void setActiveLocale(LocaleKey locale) {
        this.activeLocale = Objects.requireNonNull(locale, "locale");
        accessor.setActiveLocale(locale);
    }

    public ResourceGroupId groupId() {
        return binding.get().groupId();
    }

    public LocaleResourceTable table() {
        return binding.get().table();
    }

    private record Binding(ResourceGroupId groupId, LocaleResourceTable table) {
    }
}
