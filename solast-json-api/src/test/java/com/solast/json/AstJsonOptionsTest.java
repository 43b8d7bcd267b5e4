package com.solast.json;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonOptionsTest {

    @Test
    void testDefaults() {
        AstJsonOptions options = AstJsonOptions.defaults();
        assertEquals(SchemaVariant.CURRENT, options.schemaVariant());
        assertFalse(options.isLegacy());
        assertTrue(options.sourceIndices().isEmpty());
        assertSame(options, AstJsonOptions.defaults());
    }

    @Test
    void testSourceIndicesKeepInsertionOrder() {
        Map<String, Integer> indices = new LinkedHashMap<>();
        indices.put("z.sol", 0);
        indices.put("a.sol", 1);
        AstJsonOptions options = AstJsonOptions.builder().sourceIndices(indices).sourceIndex("m.sol", 2).build();

        assertEquals(List.of("z.sol", "a.sol", "m.sol"), List.copyOf(options.sourceIndices().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> options.sourceIndices().put("x.sol", 3));
    }

    @Test
    void testRejectsNegativeIndex() {
        assertThrows(IllegalArgumentException.class, () -> AstJsonOptions.builder().sourceIndex("a.sol", -1));
        assertThrows(NullPointerException.class, () -> AstJsonOptions.builder().sourceIndex(null, 0));
    }

    @Test
    void testToBuilderCopies() {
        AstJsonOptions original = AstJsonOptions.builder().legacy(true).sourceIndex("a.sol", 0).build();
        AstJsonOptions copy = original.toBuilder().sourceIndex("b.sol", 1).build();

        assertTrue(copy.isLegacy());
        assertEquals(2, copy.sourceIndices().size());
        assertEquals(1, original.sourceIndices().size());
        assertTrue(copy.toString().contains("LEGACY"));
    }
}
