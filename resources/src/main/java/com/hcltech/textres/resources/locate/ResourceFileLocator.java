package com.hcltech.textres.resources.locate;

import com.hcltech.textres.resources.locale.LocaleKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds the files of a resource group and the locale each one holds.
 * <p>
 * The default file {@code <identifier>.txt} always comes first. Every other listed {@code .txt} file whose
 * name contains the group's base file name is a candidate, and its locale is the tag between the culture
 * delimiter following the base name and the extension ({@code Resources.Greeting_de-DE.txt} is {@code de-DE}).
 * The containment test is loose: a group {@code Greeting} also picks up {@code GreetingCard_fr.txt}
 * in the same directory.
 */
public final class ResourceFileLocator {
    public static final String DEFAULT_CULTURE_DELIMITER = "_";

    private static final Logger log = LoggerFactory.getLogger(ResourceFileLocator.class);

    private final String cultureDelimiter;

    public ResourceFileLocator() {
        this(DEFAULT_CULTURE_DELIMITER);
    }

    public ResourceFileLocator(String cultureDelimiter) {
        this.cultureDelimiter = Objects.requireNonNull(cultureDelimiter, "cultureDelimiter");
        if (cultureDelimiter.isEmpty()) throw new IllegalArgumentException("cultureDelimiter cannot be empty");
    }

    /**
     * @throws com.hcltech.textres.resources.locale.InvalidLocaleTagException if a candidate carries a malformed tag
     */
    public List<ResourceFileDescriptor> locate(ResourceGroupId groupId, DirectoryLister lister) {
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(lister, "lister");

        String defaultFileName = groupId.defaultFileName();
        String baseFileName = groupId.baseFileName();

        List<ResourceFileDescriptor> out = new ArrayList<>();
        out.add(new ResourceFileDescriptor(defaultFileName, LocaleKey.INVARIANT));
        for (String file : lister.listFiles(groupId.resourceDirectory())) {
            if (file.equals(defaultFileName)
                    || !file.endsWith(ResourceGroupId.EXTENSION)
                    || !file.contains(baseFileName)) continue;
            out.add(new ResourceFileDescriptor(file, localeOf(file, baseFileName)));
        }
        log.debug("Located {} file(s) for {}: {}", out.size(), groupId, out);
        return out;
    }

    /**
     * Locale encoded in a file name of the group whose base file name is {@code baseFileName}. The tag runs
     * from just after {@code <baseFileName><delimiter>} to the extension, or from the first delimiter when the
     * base name is not followed by one, so {@code Greeting_en_US.txt} holds {@code en-US}. Invariant when the
     * name carries no culture delimiter.
     */
    public LocaleKey localeOf(String fileName, String baseFileName) {
        String stem = fileName.endsWith(ResourceGroupId.EXTENSION)
                ? fileName.substring(0, fileName.length() - ResourceGroupId.EXTENSION.length())
                : fileName;
        // tags never contain '.', so only the last path component can hold one
        String name = cultureDelimiter.contains(".") ? stem : stem.substring(stem.lastIndexOf('.') + 1);
        String marker = baseFileName + cultureDelimiter;
        int afterBase = name.indexOf(marker);
        if (afterBase >= 0) return LocaleKey.parse(name.substring(afterBase + marker.length()));
        int at = name.indexOf(cultureDelimiter);
        if (at < 0) return LocaleKey.INVARIANT;
        return LocaleKey.parse(name.substring(at + cultureDelimiter.length()));
    }
}
