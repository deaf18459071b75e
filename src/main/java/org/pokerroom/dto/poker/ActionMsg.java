package org.pokerroom.dto.poker;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.pokerroom.model.poker.ActionType;

@Data
public class ActionMsg {
    @NotNull
    private Long tableId;
    @NotNull
    private ActionType action;
    private long amount; // BET: jetons ajoutés, RAISE: total visé
}
