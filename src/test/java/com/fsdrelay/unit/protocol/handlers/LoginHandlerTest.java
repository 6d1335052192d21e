/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.unit.protocol.handlers;

import com.fsdrelay.auth.AuthResult;
import com.fsdrelay.auth.UserAuthenticator;
import com.fsdrelay.auth.UserRecord;
import com.fsdrelay.protocol.ClientState;
import com.fsdrelay.protocol.ClientType;
import com.fsdrelay.protocol.Session;
import com.fsdrelay.protocol.auth.LoginHandler;
import com.fsdrelay.protocol.core.ServerPackets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("LoginHandler")
class LoginHandlerTest extends HandlerTestSupport {

    private static final String PILOT_LOGIN = "#APBAW123:SERVER:1234567:secret:1:100:1:Jane Pilot";
    private static final String ATC_LOGIN = "#AAEGLL_TWR:SERVER:John Controller:7654321:tower:5:100";

    private UserAuthenticator authenticator;
    private LoginHandler handler;

    @BeforeEach
    void setUp() {
        authenticator = mock(UserAuthenticator.class);
        handler = new LoginHandler(registry, bus, authenticator);
        registry.mutate(REQUESTER, s -> {
            s.setCallsign("BAW123");
            s.transitionTo(ClientState.IDENTIFIED);
        });
    }

    @Nested
    @DisplayName("Pilot login")
    class PilotLogin {

        @BeforeEach
        void credentials() {
            when(authenticator.authenticate("1234567", "secret"))
                    .thenReturn(AuthResult.success(new UserRecord("Jane Pilot", 2, 3)));
        }

        @Test
        @DisplayName("Activates the session with the pilot rating")
        void activates() throws Exception {
            handler.handle(request(REQUESTER, PILOT_LOGIN));

            Session session = registry.get(REQUESTER).orElseThrow();
            assertEquals(ClientState.ACTIVE, session.getState());
            assertEquals(ClientType.PILOT, session.getClientType());
            assertEquals("Jane Pilot", session.getRealName());
            assertEquals(3, session.getRating());
            assertEquals("1234567", session.getNetworkId());
            assertEquals(Optional.of(REQUESTER), registry.resolveCallsign("BAW123"));
        }

        @Test
        @DisplayName("Sends welcome text, capabilities, IP and the missing flight plan notice")
        void repliesToRequester() throws Exception {
            handler.handle(request(REQUESTER, PILOT_LOGIN));

            List<String> lines = requester.lines();
            assertEquals(ServerPackets.WELCOME_LINES.size() + 3, lines.size());
            for (int i = 0; i < ServerPackets.WELCOME_LINES.size(); i++) {
                assertEquals("#TMserver:BAW123:" + ServerPackets.WELCOME_LINES.get(i), lines.get(i));
            }
            int n = ServerPackets.WELCOME_LINES.size();
            assertEquals("$CQSERVER:BAW123:CAPS", lines.get(n));
            assertEquals("$CRSERVER:BAW123:IP:10.1.1.1", lines.get(n + 1));
            assertEquals("$ERserver:BAW123:008:BAW123:No flightplan", lines.get(n + 2));
        }

        @Test
        @DisplayName("Announces the new client to everyone else")
        void announcesJoin() throws Exception {
            handler.handle(request(REQUESTER, PILOT_LOGIN));

            assertEquals(List.of("#APBAW123:SERVER:1234567:secret:1:100:1:Jane Pilot"), bystander.lines());
        }
    }

    @Test
    @DisplayName("Controller login gets the ATC capability set and the ATC rating")
    void controllerLogin() throws Exception {
        registry.mutate(REQUESTER, s -> s.setCallsign("EGLL_TWR"));
        when(authenticator.authenticate("7654321", "tower"))
                .thenReturn(AuthResult.success(new UserRecord("John Controller", 5, 1)));

        handler.handle(request(REQUESTER, ATC_LOGIN));

        Session session = registry.get(REQUESTER).orElseThrow();
        assertEquals(ClientType.ATC, session.getClientType());
        assertEquals(5, session.getRating());

        List<String> lines = requester.lines();
        int n = ServerPackets.WELCOME_LINES.size();
        assertEquals("$CQSERVER:EGLL_TWR:CAPS", lines.get(n));
        assertEquals("$CRSERVER:EGLL_TWR:CAPS:ATCINFO=1:SECPOS=1:MODELDESC=1:ONGOINGCOORD=1", lines.get(n + 1));
        assertEquals("$CRSERVER:EGLL_TWR:IP:10.1.1.1", lines.get(n + 2));
        assertEquals(n + 3, lines.size());
        assertEquals(List.of("#AAEGLL_TWR:SERVER:John Controller:7654321:tower:5:100"), bystander.lines());
    }

    @Test
    @DisplayName("Bad credentials get error 003 and leave the session IDENTIFIED")
    void badCredentials() throws Exception {
        when(authenticator.authenticate(anyString(), anyString()))
                .thenReturn(AuthResult.failure(AuthResult.AuthFailure.USER_NOT_FOUND, "Unknown network id"));

        handler.handle(request(REQUESTER, PILOT_LOGIN));

        assertEquals(List.of("$ERserver:BAW123:003::Invalid credentials"), requester.lines());
        assertTrue(bystander.lines().isEmpty());
        assertEquals(ClientState.IDENTIFIED, registry.get(REQUESTER).orElseThrow().getState());
        assertTrue(registry.resolveCallsign("BAW123").isEmpty());
    }

    @Test
    @DisplayName("Logins without password are ignored")
    void missingPassword() throws Exception {
        handler.handle(request(REQUESTER, "#APBAW123:SERVER:1234567"));

        verifyNoInteractions(authenticator);
        assertTrue(requester.lines().isEmpty());
        assertEquals(ClientState.IDENTIFIED, registry.get(REQUESTER).orElseThrow().getState());
    }
}
