/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.unit.protocol;

import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.PacketCodec;
import com.fsdrelay.protocol.PacketParseException;
import com.fsdrelay.protocol.PacketType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PacketCodec")
class PacketCodecTest {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Server identification puts destination before source")
        void serverIdentification() throws PacketParseException {
            Packet packet = PacketCodec.parse("$DISERVER:CLIENT:VATSIM FSD V3.13:TOKEN\r\n");

            assertEquals(PacketType.REQUEST, packet.getPacketType());
            assertEquals("DI", packet.getCommand());
            assertEquals("SERVER", packet.getDestination());
            assertEquals("CLIENT", packet.getSource());
            assertEquals(List.of("VATSIM FSD V3.13", "TOKEN"), packet.getData());
        }

        @Test
        @DisplayName("Text message uses source then destination")
        void textMessage() throws PacketParseException {
            Packet packet = PacketCodec.parse("#TMUAX123:BAW456:Hello there\r\n");

            assertEquals(PacketType.CLIENT, packet.getPacketType());
            assertEquals("TM", packet.getCommand());
            assertEquals("UAX123", packet.getSource());
            assertEquals("BAW456", packet.getDestination());
            assertEquals(List.of("Hello there"), packet.getData());
        }

        @Test
        @DisplayName("Pilot position update has an implicit source")
        void pilotPositionUpdate() throws PacketParseException {
            Packet packet = PacketCodec.parse("@NUAX123:1200:1:45.5:-73.5:35000:450:123456789:50\r\n");

            assertEquals(PacketType.PILOT_UPDATE, packet.getPacketType());
            assertEquals("N", packet.getCommand());
            assertEquals("UAX123", packet.getDestination());
            assertEquals("", packet.getSource());
            assertEquals(List.of("1", "45.5", "-73.5", "35000", "450", "123456789", "50"), packet.getData());
        }

        @Test
        @DisplayName("ATC position update has an implicit source")
        void atcPositionUpdate() throws PacketParseException {
            Packet packet = PacketCodec.parse("%LHR_TWR:18110:4:100:5:51.47:-0.46:0");

            assertEquals(PacketType.ATC_UPDATE, packet.getPacketType());
            assertEquals("LH", packet.getCommand());
            assertEquals("", packet.getSource());
        }

        @Test
        @DisplayName("Known one-letter commands are split off the identifier")
        void oneLetterCommand() throws PacketParseException {
            Packet packet = PacketCodec.parse("@SDLH400:2000:1:50.03:8.57:364:0:0:0");

            assertEquals("S", packet.getCommand());
            assertEquals("DLH400", packet.getDestination());
        }

        @Test
        @DisplayName("Two-letter commands win over one-letter commands")
        void twoLetterBeatsOneLetter() throws PacketParseException {
            // "CR" must not be read as command "C" with identifier "R..."
            Packet packet = PacketCodec.parse("$CRLHR_TWR:BAW1:ATIS:T:hello");

            assertEquals("CR", packet.getCommand());
            assertEquals("LHR_TWR", packet.getSource());
        }

        @Test
        @DisplayName("Unknown commands default to the first two characters")
        void unknownCommandDefaultsToTwoCharacters() throws PacketParseException {
            Packet packet = PacketCodec.parse("$AXBAW1:SERVER:METAR:EGLL");

            assertEquals("AX", packet.getCommand());
            assertEquals("BAW1", packet.getSource());
            assertEquals("SERVER", packet.getDestination());
            assertEquals(List.of("METAR", "EGLL"), packet.getData());
        }

        @Test
        @DisplayName("Empty fields are preserved, including trailing ones")
        void emptyFieldsPreserved() throws PacketParseException {
            Packet packet = PacketCodec.parse("$ERserver:BAW1:016::Unauthorized client software:");

            assertEquals(List.of("016", "", "Unauthorized client software", ""), packet.getData());
        }

        @Test
        @DisplayName("A packet without data has an empty data list")
        void noData() throws PacketParseException {
            Packet packet = PacketCodec.parse("#DPBAW1:SERVER\n");

            assertEquals("BAW1", packet.getSource());
            assertEquals("SERVER", packet.getDestination());
            assertTrue(packet.getData().isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"#TMA:B:hi\r\n", "#TMA:B:hi\n", "#TMA:B:hi\r", "  #TMA:B:hi  "})
        @DisplayName("Accepts any line terminator and surrounding whitespace")
        void terminators(String line) throws PacketParseException {
            Packet packet = PacketCodec.parse(line);

            assertEquals(List.of("hi"), packet.getData());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @ParameterizedTest
        @ValueSource(strings = {"", "\r\n", "   "})
        @DisplayName("Rejects empty input")
        void rejectsEmpty(String line) {
            PacketParseException e = assertThrows(PacketParseException.class, () -> PacketCodec.parse(line));
            assertEquals(PacketParseException.Kind.INVALID_FORMAT, e.getKind());
        }

        @Test
        @DisplayName("Rejects an unknown prefix")
        void rejectsUnknownPrefix() {
            PacketParseException e = assertThrows(PacketParseException.class,
                    () -> PacketCodec.parse("*TMA:B:hello"));
            assertEquals(PacketParseException.Kind.INVALID_FORMAT, e.getKind());
        }

        @Test
        @DisplayName("Rejects a line without delimiter")
        void rejectsMissingDelimiter() {
            PacketParseException e = assertThrows(PacketParseException.class,
                    () -> PacketCodec.parse("#TMUAX123"));
            assertEquals(PacketParseException.Kind.MISSING_FIELD, e.getKind());
        }

        @Test
        @DisplayName("Rejects null")
        void rejectsNull() {
            assertThrows(PacketParseException.class, () -> PacketCodec.parse(null));
        }
    }

    @Nested
    @DisplayName("Formatting")
    class Formatting {

        @Test
        @DisplayName("General lines survive parse then format")
        void generalRoundTrip() throws PacketParseException {
            String[] lines = {
                    "#TMUAX123:BAW456:Hello there\r\n",
                    "$CQBAW1:LHR_TWR:ATIS\r\n",
                    "#AAEGLL_TWR:SERVER:John Smith:1234567:pass:5:9\r\n",
                    "$ERserver:BAW1:016::Unauthorized client software\r\n",
                    "#DPBAW1:SERVER\r\n"
            };
            for (String line : lines) {
                assertEquals(line, PacketCodec.format(PacketCodec.parse(line)));
            }
        }

        @Test
        @DisplayName("Server identification formats destination first")
        void formatsServerIdentification() {
            Packet packet = Packet.of(PacketType.REQUEST, "DI", "CLIENT", "SERVER", "VATSIM FSD V3.13", "abc");

            assertEquals("$DISERVER:CLIENT:VATSIM FSD V3.13:abc\r\n", PacketCodec.format(packet));
        }

        @Test
        @DisplayName("Position updates format only the subject identifier")
        void formatsPositionUpdate() {
            Packet packet = Packet.of(PacketType.PILOT_UPDATE, "N", "", "UAX123", "1200", "1");

            assertEquals("@NUAX123:1200:1\r\n", PacketCodec.format(packet));
        }

        @Test
        @DisplayName("A packet without data has no trailing delimiter")
        void formatsWithoutData() {
            Packet packet = Packet.of(PacketType.CLIENT, "DP", "BAW1", "SERVER");

            assertEquals("#DPBAW1:SERVER\r\n", PacketCodec.format(packet));
        }
    }
}
