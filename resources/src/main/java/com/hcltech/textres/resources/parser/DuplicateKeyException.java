package com.hcltech.textres.resources.parser;

import com.hcltech.textres.resources.TextResourceException;

public class DuplicateKeyException extends TextResourceException {
    private final String key;
    private final String source;
    private final int lineNumber;

    public DuplicateKeyException(String key, String source, int lineNumber) {
        super("Duplicate key '" + key + "' in " + source + " at line " + lineNumber);
        this.key = key;
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public String key() {
        return key;
    }

    public String source() {
        return source;
    }

    /** 1-based line of the second occurrence. */
    public int lineNumber() {
        return lineNumber;
    }
}
