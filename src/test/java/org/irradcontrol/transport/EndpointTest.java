package org.irradcontrol.transport;

import org.irradcontrol.junit.extensions.logging.ExpectLog;
import org.irradcontrol.junit.extensions.logging.LogLevel;
import org.irradcontrol.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class EndpointTest {

    @Test
    @DisplayName("A tcp address is split into host and port")
    void parse_tcpAddress() {
        final Endpoint endpoint = Endpoint.parse("tcp://192.168.1.2:8500").orElseThrow();

        assertTrue(endpoint.isTcp());
        assertEquals("192.168.1.2", endpoint.host());
        assertEquals(8500, endpoint.port());
        assertEquals("tcp://192.168.1.2:8500", endpoint.toString());
    }

    @Test
    @DisplayName("An inproc address keeps its name")
    void parse_inprocAddress() {
        final Endpoint endpoint = Endpoint.parse("inproc://bridge").orElseThrow();

        assertFalse(endpoint.isTcp());
        assertEquals("bridge", endpoint.host());
        assertEquals("inproc://bridge", endpoint.toString());
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Incorrect address format 'localhost:8500'.*")
    @DisplayName("An address without protocol is rejected")
    void parse_missingProtocol_isRejected() {
        assertTrue(Endpoint.parse("localhost:8500").isEmpty());
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "'port' of address 'tcp://localhost:abc'.*")
    @DisplayName("A non-numeric port is rejected")
    void parse_nonNumericPort_isRejected() {
        assertTrue(Endpoint.parse("tcp://localhost:abc").isEmpty());
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "'port' of address 'tcp://localhost:70000'.*")
    @DisplayName("A port outside the valid range is rejected")
    void parse_portOutOfRange_isRejected() {
        assertTrue(Endpoint.parse("tcp://localhost:70000").isEmpty());
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Unsupported protocol 'udp'.*")
    @DisplayName("Unknown protocols are rejected")
    void parse_unknownProtocol_isRejected() {
        assertTrue(Endpoint.parse("udp://localhost:8500").isEmpty());
    }
}
