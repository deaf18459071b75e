package org.pokerroom.dto.poker;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class SeatMsg {
    @NotNull
    private Long tableId;
    private Integer seat; // null = premier siège libre
    private String displayName;
    @Positive(message = "La cave doit être > 0")
    private long buyIn;
}
