package org.pokerroom.dto.poker;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class LeaveMsg {
    @NotNull
    private Long tableId;
}
