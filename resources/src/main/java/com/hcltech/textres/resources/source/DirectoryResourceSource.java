package com.hcltech.textres.resources.source;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Files under a directory on disk. {@code <root>/Resources/Greeting_de.txt} has the logical name
 * {@code Resources.Greeting_de.txt}, and so does a flat {@code <root>/Resources.Greeting_de.txt}. Listing is
 * sorted so results do not depend on the file system.
 */
public final class DirectoryResourceSource implements ResourceSource {
    private final Path root;

    public DirectoryResourceSource(Path root) {
        this.root = Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root)) throw new IllegalArgumentException("Not a directory: " + root);
    }

    @Override
    public List<String> listFiles(String pathPrefix) {
        Objects.requireNonNull(pathPrefix, "pathPrefix");
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .map(this::logicalName)
                    .filter(name -> name.startsWith(pathPrefix))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list resource files under " + root, e);
        }
    }

    @Override
    public String readText(String fileName) {
        Objects.requireNonNull(fileName, "fileName");
        try {
            Path file = pathOf(fileName).orElseThrow(() -> new MissingResourceFileException(fileName));
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new MissingResourceFileException(fileName);
        } catch (IOException e) {
            throw new MissingResourceFileException(fileName, e);
        }
    }

    private String logicalName(Path file) {
        return root.relativize(file).toString().replace(root.getFileSystem().getSeparator(), ".");
    }

    /** The flat file if present, otherwise the first file, in path order, listed under {@code fileName}. */
    private Optional<Path> pathOf(String fileName) throws IOException {
        Path flat = root.resolve(fileName);
        if (Files.isRegularFile(flat)) return Optional.of(flat);
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> logicalName(path).equals(fileName))
                    .sorted()
                    .findFirst();
        }
    }
}
