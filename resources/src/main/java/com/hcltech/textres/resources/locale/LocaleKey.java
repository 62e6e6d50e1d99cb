package com.hcltech.textres.resources.locale;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Normalized locale tag such as {@code en} or {@code en-US}.
 * <p>
 * Tags are normalized on construction ({@code _} becomes {@code -}, the language is lower case, regions upper
 * case, scripts title case), so equality is an exact match of the normalized form. The empty tag is the
 * {@link #INVARIANT} locale used for files without a locale suffix.
 */
public record LocaleKey(String tag) {

    private static final Pattern WELL_FORMED = Pattern.compile("[A-Za-z]{2,8}([-_][A-Za-z0-9]{1,8})*");

    public static final LocaleKey INVARIANT = new LocaleKey("");

    public LocaleKey {
        Objects.requireNonNull(tag, "tag");
        tag = normalize(tag);
    }

    /** Blank or null is the invariant locale; anything else must be a well formed tag. */
    public static LocaleKey parse(String tag) {
        if (tag == null || tag.isBlank()) return INVARIANT;
        return new LocaleKey(tag);
    }

    /**
     * Language, script and region of {@code locale}; variants and extensions are dropped. A locale with no
     * language (root, {@code und}, private use only) is the invariant locale.
     */
    public static LocaleKey of(Locale locale) {
        Objects.requireNonNull(locale, "locale");
        String language = locale.getLanguage();
        if (language.isEmpty()) return INVARIANT;
        StringBuilder tag = new StringBuilder(language);
        if (!locale.getScript().isEmpty()) tag.append('-').append(locale.getScript());
        if (!locale.getCountry().isEmpty()) tag.append('-').append(locale.getCountry());
        return parse(tag.toString());
    }

    public boolean isInvariant() {
        return tag.isEmpty();
    }

    /** The primary language subtag alone; idempotent. */
    public LocaleKey languageOnly() {
        int dash = tag.indexOf('-');
        return dash < 0 ? this : new LocaleKey(tag.substring(0, dash));
    }

    public Locale toLocale() {
        return isInvariant() ? Locale.ROOT : Locale.forLanguageTag(tag);
    }

    @Override
    public String toString() {
        return isInvariant() ? "(invariant)" : tag;
    }

    private static String normalize(String raw) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) return "";
        if (!WELL_FORMED.matcher(trimmed).matches()) throw new InvalidLocaleTagException(raw);

        String[] subtags = trimmed.split("[-_]");
        StringBuilder sb = new StringBuilder(trimmed.length());
        sb.append(subtags[0].toLowerCase(Locale.ROOT));
        for (int i = 1; i < subtags.length; i++) {
            sb.append('-').append(normalizeSubtag(subtags[i]));
        }
        return sb.toString();
    }

    private static String normalizeSubtag(String subtag) {
        boolean letterFirst = Character.isLetter(subtag.charAt(0));
        if (subtag.length() == 2 && letterFirst) return subtag.toUpperCase(Locale.ROOT); // region
        if (subtag.length() == 4 && letterFirst) { // script
            return subtag.substring(0, 1).toUpperCase(Locale.ROOT) + subtag.substring(1).toLowerCase(Locale.ROOT);
        }
        return subtag.toLowerCase(Locale.ROOT);
    }
}
