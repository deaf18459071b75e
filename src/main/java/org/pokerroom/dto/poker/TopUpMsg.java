package org.pokerroom.dto.poker;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class TopUpMsg {
    @NotNull
    private Long tableId;
    @Positive(message = "Le montant doit être > 0")
    private long amount;
}
