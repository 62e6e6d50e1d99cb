package com.hcltech.textres.resources.table;

import com.hcltech.textres.resources.locale.LocaleKey;
import com.hcltech.textres.resources.parser.ResourceMapping;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LocaleResourceTableTest {

    @Test
    void findHasNoFallback() {
        LocaleResourceTable table = new LocaleResourceTable(Map.of(
                LocaleKey.parse("en"), new ResourceMapping(Map.of("k", "en"))));

        assertEquals(Optional.of("en"), table.find(LocaleKey.parse("en"), "k"));
        assertEquals(Optional.empty(), table.find(LocaleKey.parse("en-US"), "k"));
        assertEquals(Optional.empty(), table.find(LocaleKey.parse("en"), "missing"));
    }

    @Test
    void isACopyOfTheSuppliedMap() {
        Map<LocaleKey, ResourceMapping> source = new HashMap<>();
        source.put(LocaleKey.INVARIANT, ResourceMapping.EMPTY);
        LocaleResourceTable table = new LocaleResourceTable(source);

        source.put(LocaleKey.parse("fr"), ResourceMapping.EMPTY);

        assertEquals(1, table.locales().size());
        assertThrows(UnsupportedOperationException.class, () -> table.locales().clear());
    }
}
