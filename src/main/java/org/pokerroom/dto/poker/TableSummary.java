package org.pokerroom.dto.poker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class TableSummary {
    private Long id;
    private String name;
    private String stakes;
    private String variant;
    private String bettingStructure;
    private int tableSize;
    private int seated;
    private String street;
    private long handNumber;
}
