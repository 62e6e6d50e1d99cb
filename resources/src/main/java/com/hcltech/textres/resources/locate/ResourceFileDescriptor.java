package com.hcltech.textres.resources.locate;

import com.hcltech.textres.resources.locale.LocaleKey;

import java.util.Objects;

public record ResourceFileDescriptor(String fileName, LocaleKey locale) {
    public ResourceFileDescriptor {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(locale, "locale");
    }
}
