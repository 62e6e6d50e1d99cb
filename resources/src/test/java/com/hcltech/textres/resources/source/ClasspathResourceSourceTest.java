package com.hcltech.textres.resources.source;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClasspathResourceSourceTest {

    private static final List<String> FILES = List.of(
            "Resources.Greeting.txt",
            "Resources.Greeting_de.txt",
            "Resources.Nope.txt");

    @Test
    void listsOnlyTheConfiguredFiles() {
        ClasspathResourceSource source = new ClasspathResourceSource("l10n", FILES);
        assertEquals(FILES, source.listFiles("Resources"));
        assertEquals(List.of(), source.listFiles("Other"));
    }

    @Test
    void readsBelowTheRootWhateverItsSlashes() {
        for (String root : List.of("l10n", "l10n/", "/l10n/")) {
            ClasspathResourceSource source = new ClasspathResourceSource(root, FILES);
            assertTrue(source.readText("Resources.Greeting_de.txt").contains("Hello=Hallo"), root);
        }
    }

    @Test
    void usesTheGivenClassLoader() {
        ClasspathResourceSource source = new ClasspathResourceSource(getClass().getClassLoader(), "l10n/", FILES);
        assertTrue(source.readText("Resources.Greeting.txt").contains("Hello=Hi"));
    }

    @Test
    void listedButUnpackagedFileIsMissing() {
        ClasspathResourceSource source = new ClasspathResourceSource("l10n/", FILES);
        MissingResourceFileException ex = assertThrows(MissingResourceFileException.class,
                () -> source.readText("Resources.Nope.txt"));
        assertEquals("l10n/Resources.Nope.txt", ex.fileName());
    }
}
