package com.hcltech.textres.resources.locale;

import com.hcltech.textres.resources.TextResourceException;

public class InvalidLocaleTagException extends TextResourceException {
    private final String tag;

    public InvalidLocaleTagException(String tag) {
        super("Invalid locale tag: '" + tag + "'");
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
