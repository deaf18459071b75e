package org.pokerroom.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pokerroom.dto.poker.ActionMsg;
import org.pokerroom.dto.poker.LeaveMsg;
import org.pokerroom.dto.poker.SeatMsg;
import org.pokerroom.dto.poker.SitMsg;
import org.pokerroom.dto.poker.TopUpMsg;
import org.pokerroom.service.PokerTableService;
import org.pokerroom.service.poker.access.TableBroadcaster;
import org.pokerroom.service.poker.dealer.LeaveOutcome;
import org.pokerroom.service.poker.engine.ActionResult;
import org.pokerroom.service.poker.engine.SeatResult;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * STOMP entry points. Rejections and failures go back to the sender only,
 * on the poker error queue; state changes are pushed by the dealer.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class PokerWsController {

    private final PokerTableService service;
    private final TableBroadcaster broadcaster;

    // l'identité vient du handshake, jamais du contenu du message
    String resolvePlayer(Principal principal) {
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            throw new IllegalStateException("Joueur non identifié sur la socket");
        }
        return principal.getName();
    }

    @MessageMapping("/poker/seat")
    public void seat(@Valid SeatMsg msg, Principal principal) {
        String playerId = resolvePlayer(principal);
        try {
            SeatResult r = service.seat(playerId, msg);
            if (!r.ok()) broadcaster.error(playerId, r.reason().name(), "siège " + r.seat());
        } catch (IllegalArgumentException | IllegalStateException ex) {
            log.debug("seat refusé pour {}: {}", playerId, ex.getMessage());
            broadcaster.error(playerId, "BAD_REQUEST", ex.getMessage());
        }
    }

    @MessageMapping("/poker/action")
    public void action(@Valid ActionMsg msg, Principal principal) {
        String playerId = resolvePlayer(principal);
        try {
            ActionResult r = service.act(playerId, msg);
            if (!r.accepted()) broadcaster.error(playerId, r.reason().name(), msg.getAction() + " " + msg.getAmount());
        } catch (IllegalArgumentException | IllegalStateException ex) {
            log.debug("action refusée pour {}: {}", playerId, ex.getMessage());
            broadcaster.error(playerId, "BAD_REQUEST", ex.getMessage());
        }
    }

    @MessageMapping("/poker/leave")
    public void leave(@Valid LeaveMsg msg, Principal principal) {
        String playerId = resolvePlayer(principal);
        try {
            LeaveOutcome out = service.leave(playerId, msg.getTableId());
            if (out == LeaveOutcome.NOT_SEATED) broadcaster.error(playerId, out.name(), "table " + msg.getTableId());
        } catch (IllegalArgumentException | IllegalStateException ex) {
            broadcaster.error(playerId, "BAD_REQUEST", ex.getMessage());
        }
    }

    @MessageMapping("/poker/sit")
    public void sit(@Valid SitMsg msg, Principal principal) {
        String playerId = resolvePlayer(principal);
        try {
            boolean seated = msg.isOut()
                    ? service.sitOut(playerId, msg.getTableId())
                    : service.sitIn(playerId, msg.getTableId());
            if (!seated) broadcaster.error(playerId, LeaveOutcome.NOT_SEATED.name(), "table " + msg.getTableId());
        } catch (IllegalArgumentException | IllegalStateException ex) {
            broadcaster.error(playerId, "BAD_REQUEST", ex.getMessage());
        }
    }

    @MessageMapping("/poker/top-up")
    public void topUp(@Valid TopUpMsg msg, Principal principal) {
        String playerId = resolvePlayer(principal);
        try {
            SeatResult r = service.topUp(playerId, msg.getTableId(), msg.getAmount());
            if (!r.ok()) broadcaster.error(playerId, r.reason().name(), "recave " + msg.getAmount());
        } catch (IllegalArgumentException | IllegalStateException ex) {
            broadcaster.error(playerId, "BAD_REQUEST", ex.getMessage());
        }
    }
}
