package com.hcltech.textres.resources.source;

import com.hcltech.textres.resources.TextResourceException;

/** A resource file could not be read. Usually a packaging problem: the file was never shipped. */
public class MissingResourceFileException extends TextResourceException {
    private final String fileName;

    public MissingResourceFileException(String fileName) {
        super("Resource file not found: " + fileName
                + " (logical names use '.' instead of '/' and exclude the namespace)");
        this.fileName = fileName;
    }

    public MissingResourceFileException(String fileName, Throwable cause) {
        super("Resource file could not be read: " + fileName, cause);
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
