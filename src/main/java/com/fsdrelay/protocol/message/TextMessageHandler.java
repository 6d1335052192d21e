/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.message;

import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.core.AbstractCommandHandler;
import com.fsdrelay.protocol.core.ServerPackets;
import com.fsdrelay.utils.LoggerUtil;

import java.util.List;

/**
 * Relays text messages ({@code #TM}).
 *
 * <p>Some clients escape a colon inside message text as {@code ::}. The relayed
 * message carries the text with those doubled delimiters collapsed to one.
 * A flight plan acknowledgment request ({@code FP:<callsign>:GET}) is answered
 * by the server and not relayed.
 */
public class TextMessageHandler extends AbstractCommandHandler {

    private static final String ESCAPED_DELIMITER = "::";
    private static final String DELIMITER = ":";

    public TextMessageHandler(SessionRegistry registry, BroadcastBus bus) {
        super(registry, bus, "TM");
    }

    @Override
    public void handle(InboundRequest request) {
        ConnectionId id = request.connectionId();
        Packet packet = request.packet();
        List<String> data = packet.getData();

        if (isFlightPlanAcknowledgment(data)) {
            String flightPlanCallsign = data.get(1);
            LoggerUtil.info(prefix(id) + "Flight plan acknowledgment from " + packet.getSource()
                    + " for " + flightPlanCallsign);
            reply(id, ServerPackets.flightPlanAck(packet.getSource(), flightPlanCallsign));
            return;
        }

        Packet unescaped = packet.withData(unescape(data));
        LoggerUtil.debug(() -> prefix(id) + "Text message " + packet.getSource() + " -> " + packet.getDestination());
        relay(id, unescaped);
    }

    static boolean isFlightPlanAcknowledgment(List<String> data) {
        return data.size() == 3 && "FP".equals(data.get(0)) && !data.get(1).isEmpty() && "GET".equals(data.get(2));
    }

    /**
     * Rejoin the message text and collapse each {@code ::} into {@code :}.
     */
    static List<String> unescape(List<String> data) {
        if (data.isEmpty()) {
            return data;
        }
        String text = String.join(DELIMITER, data);
        if (!text.contains(ESCAPED_DELIMITER)) {
            return data;
        }
        return List.of(text.replace(ESCAPED_DELIMITER, DELIMITER));
    }
}
