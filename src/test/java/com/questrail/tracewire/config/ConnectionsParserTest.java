package com.questrail.tracewire.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionsParserTest {

    private final ConnectionsParser parser = new ConnectionsParser();

    @Test
    void singleSectionKeepsOptionTextVerbatim() {
        List<ConnectionDescriptor> result = parser.parse("tcp(host=localhost,port=4228,timeout=30000)");

        assertEquals(1, result.size());
        assertEquals("tcp", result.get(0).protocolName());
        assertEquals("host=localhost,port=4228,timeout=30000", result.get(0).rawOptions());
    }

    @Test
    void quotedBackslashesSurviveUntilOptionParsing() {
        List<ConnectionDescriptor> result = parser.parse("file(filename=\"c:\\\\log.sil\"),tcp(host=x)");

        assertEquals(2, result.size());
        assertEquals("file", result.get(0).protocolName());
        assertEquals("tcp", result.get(1).protocolName());
        assertEquals("host=x", result.get(1).rawOptions());

        ProtocolOptions options = ProtocolOptions.parse("file", result.get(0).rawOptions());
        assertEquals("c:\\log.sil", options.getString("filename", null));
    }

    @Test
    void parenthesesAndCommasInsideQuotesAreOpaque() {
        List<ConnectionDescriptor> result =
            parser.parse("mem(pattern=\"(%level%), %title%\"), file(filename=\"a)b.sil\")");

        assertEquals(2, result.size());
        assertEquals("pattern=\"(%level%), %title%\"", result.get(0).rawOptions());
        assertEquals("filename=\"a)b.sil\"", result.get(1).rawOptions());
    }

    @Test
    void whitespaceAroundSeparatorsIsIgnored() {
        List<ConnectionDescriptor> result = parser.parse("  tcp() ,\n file()  ");

        assertEquals(2, result.size());
        assertEquals("tcp", result.get(0).protocolName());
        assertEquals("", result.get(0).rawOptions());
        assertEquals("file", result.get(1).protocolName());
    }

    @Test
    void emptyStringHasNoSections() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
    }

    @Test
    void protocolNameWithoutParenthesisIsRejected() {
        ConnectionsParseException e = assertThrows(ConnectionsParseException.class, () -> parser.parse("tcp"));
        assertEquals(4, e.position());
        assertTrue(e.getMessage().contains("Missing \"(\""));
    }

    @Test
    void unclosedQuoteNamesTheQuotePosition() {
        ConnectionsParseException e =
            assertThrows(ConnectionsParseException.class, () -> parser.parse("tcp(host=\"x)"));
        assertEquals(10, e.position());
    }

    @Test
    void missingClosingParenthesisPointsPastTheEnd() {
        ConnectionsParseException e =
            assertThrows(ConnectionsParseException.class, () -> parser.parse("tcp(host=x"));
        assertEquals(11, e.position());
    }

    @Test
    void sectionsMustBeSeparatedByComma() {
        ConnectionsParseException e =
            assertThrows(ConnectionsParseException.class, () -> parser.parse("tcp(host=x) file()"));
        assertEquals(13, e.position());
    }

    @Test
    void parseErrorIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> parser.parse(",tcp()"));
    }

    @Test
    void listenersSeeEachSectionInOrder() {
        List<String> seen = new ArrayList<>();
        parser.addListener(d -> seen.add("first:" + d.protocolName()));
        parser.addListener(d -> seen.add("second:" + d.protocolName()));

        parser.parse("tcp(), file()");

        assertEquals(List.of("first:tcp", "second:tcp", "first:file", "second:file"), seen);
    }

    @Test
    void sectionsBeforeAnErrorAreStillReported() {
        List<String> seen = new ArrayList<>();
        parser.addListener(d -> seen.add(d.protocolName()));

        assertThrows(ConnectionsParseException.class, () -> parser.parse("tcp(), file"));
        assertEquals(List.of("tcp"), seen);
    }

    @Test
    void removedListenerIsNotNotified() {
        List<String> seen = new ArrayList<>();
        ConnectionFoundListener listener = d -> seen.add(d.protocolName());
        parser.addListener(listener);
        parser.removeListener(listener);

        parser.parse("tcp()");

        assertTrue(seen.isEmpty());
    }
}
