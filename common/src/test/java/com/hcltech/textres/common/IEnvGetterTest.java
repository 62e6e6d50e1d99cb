package com.hcltech.textres.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IEnvGetterTest {

    private static IEnvGetter env(Map<String, String> kv) {
        Map<String, String> copy = new HashMap<>(kv);
        return copy::get;
    }

    @Nested
    @DisplayName("getStringOr")
    class GetStringOr {
        @Test
        void returnsValueWhenPresent() {
            assertEquals("abc", IEnvGetter.getStringOr(env(Map.of("X", "abc")), "X", "def"));
        }

        @Test
        void returnsDefaultWhenMissingOrBlank() {
            assertEquals("def", IEnvGetter.getStringOr(env(Map.of()), "X", "def"));
            assertEquals("def", IEnvGetter.getStringOr(env(Map.of("X", "  ")), "X", "def"));
        }
    }

    @Nested
    @DisplayName("getEnumOr")
    class GetEnumOr {
        @Test
        void parsesCaseInsensitively() {
            assertEquals(TimeUnit.SECONDS,
                    IEnvGetter.getEnumOr(env(Map.of("U", " seconds ")), "U", TimeUnit.class, TimeUnit.DAYS));
        }

        @Test
        void returnsDefaultWhenMissing() {
            assertEquals(TimeUnit.DAYS, IEnvGetter.getEnumOr(env(Map.of()), "U", TimeUnit.class, TimeUnit.DAYS));
        }

        @Test
        void throwsOnUnknownConstant() {
            var ex = assertThrows(IllegalStateException.class,
                    () -> IEnvGetter.getEnumOr(env(Map.of("U", "fortnights")), "U", TimeUnit.class, TimeUnit.DAYS));
            assertTrue(ex.getMessage().contains("U = 'fortnights'"));
        }
    }
}
