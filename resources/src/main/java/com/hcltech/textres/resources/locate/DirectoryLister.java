package com.hcltech.textres.resources.locate;

import java.util.List;

@FunctionalInterface
public interface DirectoryLister {
    /** Logical file names starting with {@code pathPrefix}; every known name when the prefix is empty. */
    List<String> listFiles(String pathPrefix);
}
