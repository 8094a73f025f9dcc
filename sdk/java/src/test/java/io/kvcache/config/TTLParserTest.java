package io.kvcache.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TTL Parser Tests")
class TTLParserTest {

    @Test
    @DisplayName("Parses every unit")
    void testParse() {
        assertEquals(Duration.ofMillis(250), TTLParser.parse("250ms"));
        assertEquals(Duration.ofSeconds(10), TTLParser.parse("10s"));
        assertEquals(Duration.ofMinutes(5), TTLParser.parse("5m"));
        assertEquals(Duration.ofHours(2), TTLParser.parse("2h"));
        assertEquals(Duration.ofDays(7), TTLParser.parse("7d"));
        assertEquals(Duration.ofDays(14), TTLParser.parse("2w"));
    }

    @Test
    @DisplayName("Parsing ignores case and surrounding space")
    void testParseLenient() {
        assertEquals(Duration.ofSeconds(30), TTLParser.parse(" 30S "));
    }

    @Test
    @DisplayName("Rejects invalid formats")
    void testParseInvalid() {
        assertThrows(IllegalArgumentException.class, () -> TTLParser.parse(null));
        assertThrows(IllegalArgumentException.class, () -> TTLParser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> TTLParser.parse("10"));
        assertThrows(IllegalArgumentException.class, () -> TTLParser.parse("10x"));
        assertThrows(IllegalArgumentException.class, () -> TTLParser.parse("-5s"));
        assertThrows(IllegalArgumentException.class, () -> TTLParser.parse("0s"));
    }

    @Test
    @DisplayName("Formats to the largest exact unit")
    void testFormat() {
        assertEquals("10s", TTLParser.format(Duration.ofSeconds(10)));
        assertEquals("90s", TTLParser.format(Duration.ofSeconds(90)));
        assertEquals("5m", TTLParser.format(Duration.ofMinutes(5)));
        assertEquals("2h", TTLParser.format(Duration.ofHours(2)));
        assertEquals("3d", TTLParser.format(Duration.ofDays(3)));
        assertEquals("1w", TTLParser.format(Duration.ofDays(7)));
        assertEquals("1500ms", TTLParser.format(Duration.ofMillis(1500)));
        assertThrows(IllegalArgumentException.class, () -> TTLParser.format(null));
    }
}
