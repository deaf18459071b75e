package org.pokerroom.events;

import lombok.RequiredArgsConstructor;
import org.pokerroom.service.PokerTableService;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

@Component
@RequiredArgsConstructor
public class WsDisconnectListener {

    private final PokerTableService service;

    @EventListener
    public void onConnect(SessionConnectEvent e) {
        Principal p = e.getUser();
        if (p != null) service.markReconnected(p.getName());
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent e) {
        Principal p = e.getUser();
        if (p != null) service.markDisconnected(p.getName());
    }
}
