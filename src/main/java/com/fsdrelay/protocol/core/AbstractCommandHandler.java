/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.core;

import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.bus.BroadcastMessage;
import com.fsdrelay.bus.Origin;
import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.Packet;

import java.util.Set;

/**
 * Base class for command handlers: holds the registry and the bus, and the two
 * ways a handler emits packets.
 *
 * <ul>
 *   <li>{@link #reply} sends a packet to the requesting connection only.</li>
 *   <li>{@link #relay} fans a packet out to every other connection.</li>
 * </ul>
 */
public abstract class AbstractCommandHandler implements CommandHandler {

    protected final SessionRegistry registry;
    protected final BroadcastBus bus;
    private final Set<String> commands;

    protected AbstractCommandHandler(SessionRegistry registry, BroadcastBus bus, String... commands) {
        if (registry == null || bus == null) {
            throw new IllegalArgumentException("Registry and bus are required");
        }
        this.registry = registry;
        this.bus = bus;
        this.commands = Set.of(commands);
    }

    @Override
    public boolean canHandle(String command) {
        return command != null && commands.contains(command);
    }

    protected void reply(ConnectionId requester, Packet packet) {
        bus.publish(BroadcastMessage.directed(Origin.server(), requester, packet));
    }

    protected void relay(ConnectionId origin, Packet packet) {
        bus.publish(BroadcastMessage.relay(Origin.connection(origin), packet));
    }

    protected static String prefix(ConnectionId id) {
        return "[" + id + "] ";
    }
}
