package org.pokerroom.dto.poker;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SitMsg {
    @NotNull
    private Long tableId;
    private boolean out; // true = sit out, false = sit back in
}
