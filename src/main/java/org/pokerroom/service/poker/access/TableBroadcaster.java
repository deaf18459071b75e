package org.pokerroom.service.poker.access;

import lombok.RequiredArgsConstructor;
import org.pokerroom.dto.poker.TableMessage;
import org.pokerroom.dto.poker.TableSummary;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * STOMP relay. Whatever goes to the table topic is seen by every subscriber,
 * so callers only hand it sanitized state; per-player views go to the user queue.
 */
@Service
@RequiredArgsConstructor
public class TableBroadcaster {
    private final SimpMessagingTemplate broker;

    public static String tableTopic(Long tableId) { return "/topic/poker/table/" + tableId; }

    public static String privateQueue(Long tableId) { return "/queue/poker/table/" + tableId; }

    public static final String ERROR_QUEUE = "/queue/poker/errors";
    public static final String LOBBY_TOPIC = "/topic/poker/lobby";

    public void toTable(Long tableId, String type, long handNumber, Object payload) {
        broker.convertAndSend(tableTopic(tableId), message(tableId, type, handNumber, payload));
    }

    public void toPlayer(String playerId, Long tableId, String type, long handNumber, Object payload) {
        broker.convertAndSendToUser(playerId, privateQueue(tableId), message(tableId, type, handNumber, payload));
    }

    public void error(String playerId, String code, String detail) {
        broker.convertAndSendToUser(playerId, ERROR_QUEUE,
                Map.of("error", code, "message", detail == null ? code : detail));
    }

    public void tableClosed(Long tableId) {
        broker.convertAndSend(tableTopic(tableId), message(tableId, "TABLE_CLOSED", 0, Map.of("tableId", tableId)));
    }

    public void lobby(List<TableSummary> tables) {
        broker.convertAndSend(LOBBY_TOPIC, tables);
    }

    private static TableMessage message(Long tableId, String type, long handNumber, Object payload) {
        return TableMessage.builder()
                .type(type)
                .tableId(tableId)
                .handNumber(handNumber)
                .payload(payload)
                .build();
    }
}
