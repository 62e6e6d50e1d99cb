package com.hcltech.textres.resources.source;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryResourceSourceTest {

    private final InMemoryResourceSource source = InMemoryResourceSource.builder()
            .file("Resources.Greeting.txt", "Hello=Hi")
            .file("Other.Thing.txt", "x=1")
            .file("Resources.Greeting_de.txt", "Hello=Hallo")
            .build();

    @Test
    void listsByPrefixInInsertionOrder() {
        assertEquals(List.of("Resources.Greeting.txt", "Resources.Greeting_de.txt"), source.listFiles("Resources"));
        assertEquals(3, source.listFiles("").size());
        assertEquals(List.of(), source.listFiles("Nothing"));
    }

    @Test
    void readsTextOrFailsWithMissingFile() {
        assertEquals("Hello=Hallo", source.readText("Resources.Greeting_de.txt"));
        MissingResourceFileException ex = assertThrows(MissingResourceFileException.class,
                () -> source.readText("Resources.Greeting_fr.txt"));
        assertEquals("Resources.Greeting_fr.txt", ex.fileName());
    }
}
