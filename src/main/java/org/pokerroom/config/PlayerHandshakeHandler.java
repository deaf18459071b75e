package org.pokerroom.config;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;

import java.security.Principal;
import java.util.Map;
import java.util.UUID;

/**
 * Identity of a socket is decided here, never by the client: an authenticated
 * request keeps its principal, otherwise the session gets a fresh server-made
 * id (sent back in the CONNECTED frame as {@code user-name}).
 */
public class PlayerHandshakeHandler extends DefaultHandshakeHandler {

    @Override
    protected Principal determineUser(ServerHttpRequest request, WebSocketHandler wsHandler,
                                      Map<String, Object> attributes) {
        Principal authenticated = super.determineUser(request, wsHandler, attributes);
        if (authenticated != null) return authenticated;
        return new PlayerPrincipal("p-" + UUID.randomUUID());
    }

    public record PlayerPrincipal(String name) implements Principal {
        @Override
        public String getName() { return name; }
    }
}
