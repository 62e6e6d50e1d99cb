package com.hcltech.textres.resources.table;

import com.hcltech.textres.resources.locale.LocaleKey;
import com.hcltech.textres.resources.locate.ResourceFileDescriptor;
import com.hcltech.textres.resources.parser.DuplicateKeyException;
import com.hcltech.textres.resources.parser.PropertyTextParser;
import com.hcltech.textres.resources.source.MissingResourceFileException;
import com.hcltech.textres.resources.source.TextReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LocaleResourceTableBuilderTest {

    private static final LocaleKey DE = LocaleKey.parse("de");

    private TextReader reader;

    @BeforeEach
    void setUp() {
        reader = mock(TextReader.class);
        when(reader.readText("G.txt")).thenReturn("Hello=Hi");
        when(reader.readText("G_de.txt")).thenReturn("Hello=Hallo");
        when(reader.readText("G_DE.txt")).thenReturn("Hello=Servus\nExtra=1");
    }

    private static ResourceFileDescriptor file(String name, LocaleKey locale) {
        return new ResourceFileDescriptor(name, locale);
    }

    @Test
    void readsEveryFileInOrderAndKeysByLocale() {
        LocaleResourceTable table = LocaleResourceTableBuilder.with(reader)
                .files(List.of(file("G.txt", LocaleKey.INVARIANT), file("G_de.txt", DE)))
                .build();

        InOrder inOrder = inOrder(reader);
        inOrder.verify(reader).readText("G.txt");
        inOrder.verify(reader).readText("G_de.txt");
        assertEquals(Set.of(LocaleKey.INVARIANT, DE), table.locales());
        assertEquals(Optional.of("Hi"), table.find(LocaleKey.INVARIANT, "Hello"));
        assertEquals(Optional.of("Hallo"), table.find(DE, "Hello"));
    }

    @Test
    void firstFileForALocaleWinsWithoutMerging() {
        LocaleResourceTable table = LocaleResourceTableBuilder.with(reader)
                .files(List.of(file("G_de.txt", DE), file("G_DE.txt", DE)))
                .build();

        assertEquals(Optional.of("Hallo"), table.find(DE, "Hello"));
        assertEquals(Optional.empty(), table.find(DE, "Extra"));
        verify(reader).readText("G_DE.txt");
    }

    @Test
    void discardedFileIsStillParsed() {
        when(reader.readText("G_DE.txt")).thenReturn("a=1\na=2");

        assertThrows(DuplicateKeyException.class, () -> LocaleResourceTableBuilder.with(reader)
                .files(List.of(file("G_de.txt", DE), file("G_DE.txt", DE)))
                .build());
    }

    @Test
    void failPolicyRejectsLocaleCollisions() {
        LocaleCollisionException ex = assertThrows(LocaleCollisionException.class, () ->
                LocaleResourceTableBuilder.with(reader)
                        .collisionPolicy(CollisionPolicy.FAIL)
                        .files(List.of(file("G_de.txt", DE), file("G_DE.txt", DE)))
                        .build());

        assertEquals(DE, ex.locale());
        assertTrue(ex.getMessage().contains("G_de.txt"));
        assertTrue(ex.getMessage().contains("G_DE.txt"));
    }

    @Test
    void missingFileAbortsTheBuild() {
        when(reader.readText("G.txt")).thenThrow(new MissingResourceFileException("G.txt"));

        assertThrows(MissingResourceFileException.class, () -> LocaleResourceTableBuilder.with(reader)
                .files(List.of(file("G.txt", LocaleKey.INVARIANT), file("G_de.txt", DE)))
                .build());
        verify(reader, never()).readText("G_de.txt");
    }

    @Test
    void usesTheSuppliedParser() {
        when(reader.readText("G.txt")).thenReturn("Msg=a\\r\\nb");

        LocaleResourceTable table = LocaleResourceTableBuilder.with(reader)
                .parser(new PropertyTextParser("<br>"))
                .files(List.of(file("G.txt", LocaleKey.INVARIANT)))
                .build();

        assertEquals(Optional.of("a<br>b"), table.find(LocaleKey.INVARIANT, "Msg"));
    }

    @Test
    void noFilesGivesAnEmptyTable() {
        assertTrue(LocaleResourceTableBuilder.with(reader).build().isEmpty());
        verifyNoInteractions(reader);
    }
}
