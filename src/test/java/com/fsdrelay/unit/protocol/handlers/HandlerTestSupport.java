/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.unit.protocol.handlers;

import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.protocol.ClientState;
import com.fsdrelay.protocol.ClientType;
import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.PacketCodec;
import com.fsdrelay.protocol.PacketParseException;
import com.fsdrelay.test.BusProbe;
import com.fsdrelay.utils.LoggerUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/**
 * Common fixture: a requester, a bystander, and probes on the bus for both.
 */
abstract class HandlerTestSupport {

    static final ConnectionId REQUESTER = new ConnectionId("10.1.1.1", 51001);
    static final ConnectionId BYSTANDER = new ConnectionId("10.2.2.2", 51002);

    SessionRegistry registry;
    BroadcastBus bus;
    BusProbe requester;
    BusProbe bystander;

    @BeforeEach
    void setUpFixture() {
        LoggerUtil.setSilent(true);
        registry = new SessionRegistry();
        bus = new BroadcastBus(100);
        registry.register(REQUESTER);
        registry.register(BYSTANDER);
        requester = new BusProbe(bus, REQUESTER);
        bystander = new BusProbe(bus, BYSTANDER);
    }

    @AfterEach
    void tearDownFixture() {
        requester.close();
        bystander.close();
        LoggerUtil.setSilent(false);
    }

    static InboundRequest request(ConnectionId from, String line) throws PacketParseException {
        return new InboundRequest(from, PacketCodec.parse(line));
    }

    void activate(ConnectionId id, String callsign, ClientType type, String realName, int rating) {
        registry.mutate(id, s -> {
            s.setCallsign(callsign);
            s.setClientType(type);
            s.setRealName(realName);
            s.setRating(rating);
            s.setNetworkId("1234567");
            s.setClientString("vPilot");
            s.transitionTo(ClientState.ACTIVE);
        });
        registry.indexCallsign(callsign, id);
    }
}
