package com.hcltech.textres.resources.table;

import com.hcltech.textres.resources.locale.LocaleKey;
import com.hcltech.textres.resources.locate.ResourceFileDescriptor;
import com.hcltech.textres.resources.parser.PropertyTextParser;
import com.hcltech.textres.resources.parser.ResourceMapping;
import com.hcltech.textres.resources.source.TextReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and parses located files, in order, into a {@link LocaleResourceTable}.
 * <pre>
 * LocaleResourceTable table = LocaleResourceTableBuilder.with(source)
 *         .files(locator.locate(groupId, source))
 *         .build();
 * </pre>
 * Any read or parse failure aborts the build; nothing partial is returned.
 */
public final class LocaleResourceTableBuilder {
    private static final Logger log = LoggerFactory.getLogger(LocaleResourceTableBuilder.class);

    private final TextReader reader;
    private PropertyTextParser parser = new PropertyTextParser();
    private CollisionPolicy collisionPolicy = CollisionPolicy.FIRST_WINS;
    private List<ResourceFileDescriptor> files = List.of();

    private LocaleResourceTableBuilder(TextReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public static LocaleResourceTableBuilder with(TextReader reader) {
        return new LocaleResourceTableBuilder(reader);
    }

    public LocaleResourceTableBuilder parser(PropertyTextParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
        return this;
    }

    public LocaleResourceTableBuilder collisionPolicy(CollisionPolicy collisionPolicy) {
        this.collisionPolicy = Objects.requireNonNull(collisionPolicy, "collisionPolicy");
        return this;
    }

    public LocaleResourceTableBuilder files(Collection<ResourceFileDescriptor> files) {
        this.files = new ArrayList<>(Objects.requireNonNull(files, "files"));
        return this;
    }

    /**
     * @throws com.hcltech.textres.resources.source.MissingResourceFileException if a file cannot be read
     * @throws com.hcltech.textres.resources.parser.DuplicateKeyException        if a file repeats a key
     * @throws LocaleCollisionException                                         under {@link CollisionPolicy#FAIL}
     */
    public LocaleResourceTable build() {
        Map<LocaleKey, ResourceMapping> byLocale = new LinkedHashMap<>();
        Map<LocaleKey, String> sourceOf = new LinkedHashMap<>();
        for (ResourceFileDescriptor file : files) {
            String text = reader.readText(file.fileName());
            ResourceMapping mapping = parser.parse(text, file.fileName());

            String first = sourceOf.putIfAbsent(file.locale(), file.fileName());
            if (first == null) {
                byLocale.put(file.locale(), mapping);
                log.debug("Loaded {} key(s) for locale {} from {}", mapping.size(), file.locale(), file.fileName());
            } else if (collisionPolicy == CollisionPolicy.FAIL) {
                throw new LocaleCollisionException(file.locale(), first, file.fileName());
            } else {
                log.debug("Ignoring {}: locale {} already loaded from {}", file.fileName(), file.locale(), first);
            }
        }
        return new LocaleResourceTable(byLocale);
    }
}
