package org.pokerroom.dto.poker;

import lombok.Builder;
import lombok.Data;

/** Envelope of everything pushed on the table topic and the private queues. */
@Data
@Builder
public class TableMessage {
    private String type;
    private Long tableId;
    private long handNumber;
    private Object payload;
}
