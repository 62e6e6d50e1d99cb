package com.hcltech.textres.resources.locate;

import java.util.Objects;

/**
 * Dotted logical name of a resource group, e.g. {@code Shared.Resources.LocalizationResources}.
 * <p>
 * The first segment is the owning namespace and is not part of the on-disk layout. The rest is the
 * resource identifier: {@code Resources.LocalizationResources}, whose last component is the base file name
 * and whose leading components are the resource directory.
 */
public record ResourceGroupId(String value) {
    public static final String EXTENSION = ".txt";

    public ResourceGroupId {
        Objects.requireNonNull(value, "value");
        int dot = value.indexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            throw new IllegalArgumentException(
                    "Resource group id must be <namespace>.<resource identifier>, got '" + value + "'");
        }
    }

    public static ResourceGroupId of(String value) {
        return new ResourceGroupId(value);
    }

    /** Everything after the first segment. */
    public String resourceIdentifier() {
        return value.substring(value.indexOf('.') + 1);
    }

    public String baseFileName() {
        String id = resourceIdentifier();
        return id.substring(id.lastIndexOf('.') + 1);
    }

    /** Components of the resource identifier before the base file name; empty when there are none. */
    public String resourceDirectory() {
        String id = resourceIdentifier();
        int last = id.lastIndexOf('.');
        return last < 0 ? "" : id.substring(0, last);
    }

    public String defaultFileName() {
        return resourceIdentifier() + EXTENSION;
    }

    @Override
    public String toString() {
        return value;
    }
}
