package com.hcltech.textres.resources.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Files held in memory, listed in insertion order. */
public final class InMemoryResourceSource implements ResourceSource {
    private final Map<String, String> files;

    public InMemoryResourceSource(Map<String, String> files) {
        Objects.requireNonNull(files, "files");
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<String> listFiles(String pathPrefix) {
        Objects.requireNonNull(pathPrefix, "pathPrefix");
        List<String> out = new ArrayList<>();
        for (String name : files.keySet()) {
            if (name.startsWith(pathPrefix)) out.add(name);
        }
        return out;
    }

    @Override
    public String readText(String fileName) {
        String text = files.get(fileName);
        if (text == null) throw new MissingResourceFileException(fileName);
        return text;
    }

    public static final class Builder {
        private final Map<String, String> files = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder file(String name, String text) {
            files.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(text, "text"));
            return this;
        }

        public InMemoryResourceSource build() {
            return new InMemoryResourceSource(files);
        }
    }
}
