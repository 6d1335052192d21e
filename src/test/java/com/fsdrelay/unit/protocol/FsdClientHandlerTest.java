/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.unit.protocol;

import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.bus.BroadcastMessage;
import com.fsdrelay.bus.Origin;
import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.FsdClientHandler;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.PacketType;
import com.fsdrelay.protocol.RequestSink;
import com.fsdrelay.test.TestChannels;
import com.fsdrelay.utils.LoggerUtil;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.TooLongFrameException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("FsdClientHandler")
class FsdClientHandlerTest {

    private static final ConnectionId SELF = new ConnectionId("192.168.1.10", 40001);
    private static final ConnectionId OTHER = new ConnectionId("192.168.1.20", 40002);

    private SessionRegistry registry;
    private BroadcastBus bus;
    private RequestSink sink;
    private FsdClientHandler handler;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() throws Exception {
        LoggerUtil.setSilent(true);
        registry = new SessionRegistry();
        bus = new BroadcastBus(16);
        sink = mock(RequestSink.class);
        when(sink.offer(any())).thenReturn(true);
        handler = new FsdClientHandler(registry, bus, sink, "VATSIM FSD V3.13");
        channel = TestChannels.connect(SELF.host(), SELF.port(), handler);
    }

    @AfterEach
    void tearDown() {
        if (channel != null && channel.isOpen()) {
            channel.close();
        }
        LoggerUtil.setSilent(false);
    }

    @Nested
    @DisplayName("Connection lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Registers a session and subscribes on activation")
        void registersOnActive() {
            assertEquals(SELF, handler.getConnectionId());
            assertTrue(registry.get(SELF).isPresent());
            assertEquals(1, bus.subscriberCount());
        }

        @Test
        @DisplayName("Greets the client with a server identification packet")
        void sendsServerIdentification() {
            String greeting = channel.readOutbound();

            assertNotNull(greeting);
            assertTrue(greeting.matches("\\$DISERVER:CLIENT:VATSIM FSD V3\\.13:[0-9a-f]{22}\r\n"), greeting);
        }

        @Test
        @DisplayName("Every connection gets a fresh token")
        void freshTokens() throws Exception {
            EmbeddedChannel second = TestChannels.connect(OTHER.host(), OTHER.port(),
                    new FsdClientHandler(registry, bus, sink, "VATSIM FSD V3.13"));

            String first = channel.readOutbound();
            String other = second.readOutbound();
            assertNotEquals(first, other);
            second.close();
        }

        @Test
        @DisplayName("Cleans up session and subscription on close")
        void cleansUpOnClose() {
            registry.mutate(SELF, s -> s.setCallsign("BAW1"));
            registry.indexCallsign("BAW1", SELF);

            channel.close();
            channel.runPendingTasks();

            assertTrue(registry.get(SELF).isEmpty());
            assertTrue(registry.resolveCallsign("BAW1").isEmpty());
            assertEquals(0, bus.subscriberCount());
        }

        @Test
        @DisplayName("Closes the channel on pipeline errors")
        void closesOnError() {
            channel.pipeline().fireExceptionCaught(new RuntimeException("boom"));

            assertFalse(channel.isOpen());
        }

        @Test
        @DisplayName("Keeps the connection after an oversized line")
        void keepsConnectionOnLongLine() {
            channel.pipeline().fireExceptionCaught(new TooLongFrameException("frame length exceeds 4096"));

            assertTrue(channel.isOpen());
        }
    }

    @Nested
    @DisplayName("Inbound")
    class Inbound {

        @Test
        @DisplayName("Parses lines and hands them to the sink")
        void forwardsParsedPackets() {
            channel.writeInbound("#TMBAW1:DLH2:Hello there");

            ArgumentCaptor<InboundRequest> captor = ArgumentCaptor.forClass(InboundRequest.class);
            verify(sink).offer(captor.capture());
            assertEquals(SELF, captor.getValue().connectionId());
            assertEquals("TM", captor.getValue().command());
            assertEquals("DLH2", captor.getValue().packet().getDestination());
        }

        @Test
        @DisplayName("Skips unparsable lines and keeps the connection")
        void skipsGarbage() {
            channel.writeInbound("garbage without prefix");
            channel.writeInbound("");

            verify(sink, never()).offer(any());
            assertTrue(channel.isOpen());
        }

        @Test
        @DisplayName("Pauses reads while the sink is full and replays in order")
        void backPressure() {
            when(sink.offer(any())).thenReturn(false);

            channel.writeInbound("#TMBAW1:*:one");
            channel.writeInbound("#TMBAW1:*:two");

            assertFalse(channel.config().isAutoRead());
            assertEquals(2, handler.pendingRequests());

            reset(sink);
            when(sink.offer(any())).thenReturn(true);
            channel.advanceTimeBy(FsdClientHandler.PENDING_RETRY_MILLIS, TimeUnit.MILLISECONDS);
            channel.runScheduledPendingTasks();

            ArgumentCaptor<InboundRequest> captor = ArgumentCaptor.forClass(InboundRequest.class);
            verify(sink, times(2)).offer(captor.capture());
            assertEquals("one", captor.getAllValues().get(0).packet().dataAt(0));
            assertEquals("two", captor.getAllValues().get(1).packet().dataAt(0));
            assertEquals(0, handler.pendingRequests());
            assertTrue(channel.config().isAutoRead());
        }
    }

    @Nested
    @DisplayName("Outbound")
    class Outbound {

        @BeforeEach
        void discardGreeting() {
            channel.readOutbound();
        }

        @Test
        @DisplayName("Writes packets relayed by other connections")
        void writesRelayed() {
            bus.publish(BroadcastMessage.relay(Origin.connection(OTHER),
                    Packet.of(PacketType.CLIENT, "TM", "DLH2", "*", "hi")));

            assertEquals("#TMDLH2:*:hi\r\n", channel.readOutbound());
        }

        @Test
        @DisplayName("Does not echo its own packets")
        void noEcho() {
            bus.publish(BroadcastMessage.relay(Origin.connection(SELF),
                    Packet.of(PacketType.CLIENT, "TM", "BAW1", "*", "hi")));

            assertNull(channel.readOutbound());
        }

        @Test
        @DisplayName("Writes replies directed at this connection")
        void writesDirected() {
            bus.publish(BroadcastMessage.directed(Origin.server(), SELF,
                    Packet.of(PacketType.REQUEST, "ER", "server", "BAW1", "003", "", "Invalid credentials")));

            assertEquals("$ERserver:BAW1:003::Invalid credentials\r\n", channel.readOutbound());
        }

        @Test
        @DisplayName("Closes the connection on a targeted disconnect")
        void closesOnDisconnect() {
            bus.publish(BroadcastMessage.disconnect(Origin.server(), SELF, "squawk 7500"));
            channel.runPendingTasks();

            assertFalse(channel.isOpen());
            assertTrue(registry.get(SELF).isEmpty());
        }

        @Test
        @DisplayName("Ignores disconnects for other connections")
        void ignoresOtherDisconnect() {
            bus.publish(BroadcastMessage.disconnect(Origin.server(), OTHER, "squawk 7500"));

            assertTrue(channel.isOpen());
        }
    }
}
