package org.pokerroom.config;

import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.socket.WebSocketHandler;

import java.security.Principal;
import java.util.HashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class PlayerHandshakeHandlerTest {

    private final PlayerHandshakeHandler handler = new PlayerHandshakeHandler();
    private final WebSocketHandler ws = mock(WebSocketHandler.class);

    @Test
    void authenticatedRequest_keepsItsPrincipal() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        Principal alice = () -> "alice";
        req.setUserPrincipal(alice);

        Principal p = handler.determineUser(new ServletServerHttpRequest(req), ws, new HashMap<>());

        assertThat(p.getName()).isEqualTo("alice");
    }

    @Test
    void anonymousRequest_getsServerMadeId_ignoringClientHints() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setParameter("playerId", "bob");
        req.addHeader("playerId", "bob");

        Principal a = handler.determineUser(new ServletServerHttpRequest(req), ws, new HashMap<>());
        Principal b = handler.determineUser(new ServletServerHttpRequest(req), ws, new HashMap<>());

        assertThat(a.getName()).startsWith("p-").isNotEqualTo("bob");
        assertThat(b.getName()).isNotEqualTo(a.getName());
    }
}
