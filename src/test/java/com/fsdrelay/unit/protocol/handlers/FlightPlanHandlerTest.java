/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.unit.protocol.handlers;

import com.fsdrelay.protocol.flightplan.FlightPlanHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FlightPlanHandler")
class FlightPlanHandlerTest extends HandlerTestSupport {

    @Test
    @DisplayName("Relays the flight plan and acknowledges it to the filer")
    void relaysAndAcknowledges() throws Exception {
        FlightPlanHandler handler = new FlightPlanHandler(registry, bus);
        String line = "$FPBAW123:*A:I:B738/L:450:EGLL:1200:1200:35000:KJFK:7:30:9:0:EGKK:remarks:DVR UL9 KONAN";

        handler.handle(request(REQUESTER, line));

        assertEquals(List.of(line), bystander.lines());
        assertEquals(List.of("#PCserver:BAW123:CCP:BC:BAW123:0"), requester.lines());
    }
}
