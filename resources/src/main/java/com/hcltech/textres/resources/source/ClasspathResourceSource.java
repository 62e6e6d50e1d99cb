package com.hcltech.textres.resources.source;

import com.hcltech.textres.common.resources.LoadFromInputStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Files packaged on the classpath under {@code root}, read as UTF-8.
 * <p>
 * Classpath directories cannot be enumerated portably (jars, module images), so the file list is supplied,
 * usually from {@link com.hcltech.textres.resources.config.TextResourcesConfig#files()}. Logical names are used
 * as-is below the root: {@code l10n/} + {@code Resources.Greeting_de.txt}.
 */
public final class ClasspathResourceSource implements ResourceSource {
    private final ClassLoader loader;
    private final String root;
    private final List<String> files;

    public ClasspathResourceSource(String root, List<String> files) {
        this(null, root, files);
    }

    /** A null loader means the thread context loader at read time. */
    public ClasspathResourceSource(ClassLoader loader, String root, List<String> files) {
        this.loader = loader;
        this.root = normalizeRoot(Objects.requireNonNull(root, "root"));
        this.files = List.copyOf(Objects.requireNonNull(files, "files"));
    }

    @Override
    public List<String> listFiles(String pathPrefix) {
        Objects.requireNonNull(pathPrefix, "pathPrefix");
        List<String> out = new ArrayList<>();
        for (String name : files) {
            if (name.startsWith(pathPrefix)) out.add(name);
        }
        return out;
    }

    @Override
    public String readText(String fileName) {
        Objects.requireNonNull(fileName, "fileName");
        try {
            return LoadFromInputStream.tryLoadFromClasspath(loader, root, fileName, LoadFromInputStream.UTF8_TEXT)
                    .orElseThrow(() -> new MissingResourceFileException(root + fileName));
        } catch (MissingResourceFileException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MissingResourceFileException(root + fileName, e);
        }
    }

    private static String normalizeRoot(String root) {
        String r = root.startsWith("/") ? root.substring(1) : root;
        return (r.isEmpty() || r.endsWith("/")) ? r : r + "/";
    }
}
