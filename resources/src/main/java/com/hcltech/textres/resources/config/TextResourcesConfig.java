package com.hcltech.textres.resources.config;

import com.hcltech.textres.resources.locate.ResourceFileLocator;
import com.hcltech.textres.resources.parser.PropertyTextParser;
import com.hcltech.textres.resources.table.CollisionPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings for binding resource groups. Missing JSON properties take the defaults below.
 *
 * @param cultureDelimiter separates the identifier from the locale tag in file names ({@code _})
 * @param collisionPolicy  two files for one locale: keep the first or fail ({@code FIRST_WINS})
 * @param lineBreak        replacement for the {@code \r\n} escape inside values ({@code "\n"})
 * @param classpathRoot    prefix of packaged resource files ({@code ""})
 * @param files            logical names of the packaged files, for classpath sources
 */
public record TextResourcesConfig(String cultureDelimiter,
                                  CollisionPolicy collisionPolicy,
                                  String lineBreak,
                                  String classpathRoot,
                                  List<String> files) {

    public static final TextResourcesConfig DEFAULTS = new TextResourcesConfig(null, null, null, null, null);

    public TextResourcesConfig {
        cultureDelimiter = cultureDelimiter == null ? ResourceFileLocator.DEFAULT_CULTURE_DELIMITER : cultureDelimiter;
        collisionPolicy = collisionPolicy == null ? CollisionPolicy.FIRST_WINS : collisionPolicy;
        lineBreak = lineBreak == null ? PropertyTextParser.DEFAULT_LINE_BREAK : lineBreak;
        classpathRoot = classpathRoot == null ? "" : classpathRoot;
        files = files == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(files));
    }

    public TextResourcesConfig withCultureDelimiter(String cultureDelimiter) {
        return new TextResourcesConfig(cultureDelimiter, collisionPolicy, lineBreak, classpathRoot, files);
    }

    public TextResourcesConfig withCollisionPolicy(CollisionPolicy collisionPolicy) {
        return new TextResourcesConfig(cultureDelimiter, collisionPolicy, lineBreak, classpathRoot, files);
    }

    public TextResourcesConfig withLineBreak(String lineBreak) {
        return new TextResourcesConfig(cultureDelimiter, collisionPolicy, lineBreak, classpathRoot, files);
    }

    public ResourceFileLocator locator() {
        return new ResourceFileLocator(cultureDelimiter);
    }

    public PropertyTextParser parser() {
        return new PropertyTextParser(lineBreak);
    }
}
