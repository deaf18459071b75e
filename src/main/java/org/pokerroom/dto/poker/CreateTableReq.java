package org.pokerroom.dto.poker;

import jakarta.validation.constraints.*;
import lombok.Data;
import org.pokerroom.model.poker.BettingStructure;
import org.pokerroom.model.poker.PokerVariant;

@Data
public class CreateTableReq {
    @NotBlank
    private String name;
    @Min(2) @Max(9)
    private Integer tableSize;
    @NotNull @Positive
    private Long smallBlind;
    @NotNull @Positive
    private Long bigBlind;
    private Long minBuyIn;
    private Long maxBuyIn;
    private Integer timeLimitSeconds;
    private BettingStructure bettingStructure;
    private PokerVariant variant;
}
