package com.hcltech.textres.resources.table;

import com.hcltech.textres.resources.TextResourceException;
import com.hcltech.textres.resources.locale.LocaleKey;

public class LocaleCollisionException extends TextResourceException {
    private final LocaleKey locale;

    public LocaleCollisionException(LocaleKey locale, String firstFile, String secondFile) {
        super("Files '" + firstFile + "' and '" + secondFile + "' both resolve to locale " + locale);
        this.locale = locale;
    }

    public LocaleKey locale() {
        return locale;
    }
}
