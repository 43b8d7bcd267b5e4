package com.solast.json;

import com.solast.ast.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SourceLocationEncoderTest {

    private final SourceLocationEncoder encoder = new SourceLocationEncoder(Map.of("a.sol", 0, "b.sol", 7));

    @Test
    void testEncode() {
        assertEquals("0:53:0", encoder.encode(new SourceLocation(0, 53, "a.sol")));
        assertEquals("12:4:7", encoder.encode(new SourceLocation(12, 16, "b.sol")));
    }

    @Test
    void testUnknownSourceIsMinusOne() {
        assertEquals("3:2:-1", encoder.encode(new SourceLocation(3, 5, "c.sol")));
        assertEquals("3:2:-1", encoder.encode(new SourceLocation(3, 5)));
    }

    @Test
    void testNegativeOffsetsGiveUnknownLength() {
        assertEquals("-1:-1:-1", encoder.encode(SourceLocation.unknown()));
        assertEquals("5:-1:0", encoder.encode(new SourceLocation(5, -1, "a.sol")));
        assertEquals("-1:-1:0", encoder.encode(new SourceLocation(-1, 9, "a.sol")));
    }

    @Test
    void testDecode() {
        SourceLocationEncoder.Src src = SourceLocationEncoder.decode(encoder.encode(new SourceLocation(12, 16, "b.sol")));
        assertEquals(12, src.start());
        assertEquals(4, src.length());
        assertEquals(16, src.end());
        assertEquals(7, src.sourceIndex());

        SourceLocationEncoder.Src unknown = SourceLocationEncoder.decode("5:-1:-1");
        assertFalse(unknown.hasLength());
        assertEquals(-1, unknown.end());
    }

    @Test
    void testDecodeRejectsMalformedText() {
        assertThrows(AstJsonException.class, () -> SourceLocationEncoder.decode("1:2"));
        assertThrows(AstJsonException.class, () -> SourceLocationEncoder.decode("1:2:3:4"));
        AstJsonException e = assertThrows(AstJsonException.class, () -> SourceLocationEncoder.decode("a:b:c"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }
}
