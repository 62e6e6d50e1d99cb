package com.hcltech.textres.common.resources;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

@FunctionalInterface
public interface LoadFromInputStream<I, O> {
    O apply(I in) throws Exception;

    LoadFromInputStream<InputStream, String> UTF8_TEXT = in -> new String(in.readAllBytes(), StandardCharsets.UTF_8);

    /**
     * Loads {@code prefix + name} with the given loader (the thread context loader when null, then this
     * interface's own loader). Empty if no such resource exists.
     */
    static <T> Optional<T> tryLoadFromClasspath(ClassLoader loader,
                                                String prefix,
                                                String name,
                                                LoadFromInputStream<InputStream, T> fn) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fn, "fn");

        String full = prefix + name;
        ClassLoader cl = loader != null ? loader : Thread.currentThread().getContextClassLoader();
        InputStream found = cl == null ? null : cl.getResourceAsStream(full);
        if (found == null) {
            found = LoadFromInputStream.class.getClassLoader().getResourceAsStream(full);
        }
        if (found == null) return Optional.empty();

        try (InputStream in = found) {
            return Optional.of(fn.apply(in));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to load resource: " + full, e);
        }
    }
}
