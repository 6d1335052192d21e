/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.request;

import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.core.AbstractCommandHandler;
import com.fsdrelay.utils.LoggerUtil;

/**
 * Relays client responses ({@code $CR}) unchanged.
 */
public class ClientResponseHandler extends AbstractCommandHandler {

    public ClientResponseHandler(SessionRegistry registry, BroadcastBus bus) {
        super(registry, bus, "CR");
    }

    @Override
    public void handle(InboundRequest request) {
        LoggerUtil.debug(() -> prefix(request.connectionId()) + "Response " + request.packet().getSource()
                + " -> " + request.packet().getDestination());
        relay(request.connectionId(), request.packet());
    }
}
