package com.baskettecase.sqlmon.db;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionStringParser
 */
class ConnectionStringParserTest {

    @Test
    void testSimpleProperties() {
        Map<String, String> params = ConnectionStringParser.parse("A=B;C=D;");

        assertEquals(Map.of("A", "B", "C", "D"), params);
        assertEquals(List.of("A", "C"), List.copyOf(params.keySet()));
    }

    @Test
    void testTrailingSemicolonIsOptional() {
        assertEquals(Map.of("A", "B", "C", "D"), ConnectionStringParser.parse("A=B;C=D"));
    }

    @Test
    void testLeadingWhitespaceBetweenOptionsIsSkipped() {
        Map<String, String> params = ConnectionStringParser.parse("  A=B;   C=D");

        assertEquals("B", params.get("A"));
        assertEquals("D", params.get("C"));
    }

    @Test
    void testWhitespaceInsideValueIsKept() {
        assertEquals(" B C", ConnectionStringParser.parse("A= B C").get("A"));
    }

    @Test
    void testEscapedValueMayContainReservedCharacters() {
        Map<String, String> params = ConnectionStringParser.parse("A={x;y=z};B=2");

        assertEquals("x;y=z", params.get("A"));
        assertEquals("2", params.get("B"));
    }

    @Test
    void testDoubledClosingBraceIsLiteral() {
        assertEquals("p}w{d", ConnectionStringParser.parse("PWD={p}}w{d}").get("PWD"));
    }

    @Test
    void testEscapedKey() {
        assertEquals("B", ConnectionStringParser.parse("{Data;Source}=B").get("Data;Source"));
    }

    @Test
    void testReserializedPropertiesParseToSameMap() {
        Map<String, String> params = ConnectionStringParser.parse("Server=h,1433;PWD={a;b}}c};App={x=y}");

        StringBuilder cs = new StringBuilder();
        params.forEach((key, value) -> cs.append(key).append("={")
            .append(value.replace("}", "}}")).append("};"));

        assertEquals(params, ConnectionStringParser.parse(cs.toString()));
    }

    @Test
    void testEmptyStringHasNoProperties() {
        assertTrue(ConnectionStringParser.parse("   ").isEmpty());
    }

    @Test
    void testEmptyKeyIsRejected() {
        ConnectionConfigurationException e = assertThrows(ConnectionConfigurationException.class,
            () -> ConnectionStringParser.parse("=B"));

        assertTrue(e.getMessage().contains("empty key at index=0"));
    }

    @Test
    void testEmptyValueIsRejected() {
        ConnectionConfigurationException e = assertThrows(ConnectionConfigurationException.class,
            () -> ConnectionStringParser.parse("A=;B=C"));

        assertTrue(e.getMessage().contains("empty value at index=2"));
    }

    @Test
    void testEmptyValueAtEndIsRejected() {
        ConnectionConfigurationException e = assertThrows(ConnectionConfigurationException.class,
            () -> ConnectionStringParser.parse("A=B;C="));

        assertTrue(e.getMessage().contains("empty value at the end"));
    }

    @Test
    void testUnterminatedBraceIsRejected() {
        ConnectionConfigurationException e = assertThrows(ConnectionConfigurationException.class,
            () -> ConnectionStringParser.parse("A={abc"));

        assertTrue(e.getMessage().contains("matching closing brace"));
    }

    @Test
    void testSecondEqualsIsRejected() {
        ConnectionConfigurationException e = assertThrows(ConnectionConfigurationException.class,
            () -> ConnectionStringParser.parse("A=B=C"));

        assertTrue(e.getMessage().contains("unexpected '=' while parsing value at index=3"));
        assertTrue(e.getMessage().endsWith(": A=B=C"));
    }

    @Test
    void testUnescapedClosingBraceIsRejected() {
        ConnectionConfigurationException e = assertThrows(ConnectionConfigurationException.class,
            () -> ConnectionStringParser.parse("A=b}c"));

        assertTrue(e.getMessage().contains("invalid character '}' at index=3"));
    }

    @Test
    void testOptionWithoutValueIsRejected() {
        assertThrows(ConnectionConfigurationException.class, () -> ConnectionStringParser.parse("A=B;;"));
        assertThrows(ConnectionConfigurationException.class, () -> ConnectionStringParser.parse("A=B;junk"));
    }

    @Test
    void testErrorMessageMasksPassword() {
        ConnectionConfigurationException e = assertThrows(ConnectionConfigurationException.class,
            () -> ConnectionStringParser.parse("PWD=s3cr3t;A==b"));

        assertFalse(e.getMessage().contains("s3cr3t"));
        assertTrue(e.getMessage().contains("PWD=******"));
    }
}
