package com.hcltech.textres.resources.source;

@FunctionalInterface
public interface TextReader {
    /**
     * @throws MissingResourceFileException if no such file exists or it cannot be read
     */
    String readText(String fileName);
}
