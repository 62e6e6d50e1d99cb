package com.hcltech.textres.resources;

import com.hcltech.textres.resources.locale.LocaleKey;

import java.util.Objects;

/**
 * Ready-made {@link ResourceAccessor} for generated resource classes: hold one in a static field and expose
 * typed getters that call {@link #get(String)}.
 * <pre>
 * public final class AppStrings {
 *     public static final GeneratedResources RESOURCES = new GeneratedResources();
 *     public static String greeting() { return RESOURCES.get("Greeting"); }
 * }
 * </pre>
 */
public class GeneratedResources implements ResourceAccessor {
    private volatile ResourceResolver resolver;
    private volatile LocaleKey locale = LocaleKey.INVARIANT;

    @Override
    public void publish(ResourceResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public void setActiveLocale(LocaleKey locale) {
        this.locale = Objects.requireNonNull(locale, "locale");
    }

    public LocaleKey activeLocale() {
        return locale;
    }

    /** Empty until a resolver has been published. */
    public String get(String key) {
        ResourceResolver r = resolver;
        return r == null ? "" : r.getString(key, locale);
    }

    public boolean isPublished() {
        return resolver != null;
    }

    public ResourceResolver resolver() {
        ResourceResolver r = resolver;
        if (r == null) throw new IllegalStateException("No ResourceResolver has been published");
        return r;
    }
}
