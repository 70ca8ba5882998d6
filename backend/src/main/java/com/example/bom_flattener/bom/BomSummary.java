package com.example.bom_flattener.bom;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Getter
@ToString
public class BomSummary {

    private final List<SummaryRow> rows;
    private final BigDecimal totalCost;

    BomSummary(List<SummaryRow> rows) {
        this.rows = List.copyOf(rows);
        this.totalCost = Quantities.normalize(rows.stream()
                .map(SummaryRow::getExtendedCost)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    public Optional<SummaryRow> find(String partNumber) {
        return rows.stream()
                .filter(row -> row.getPartNumber().equals(partNumber))
                .findFirst();
    }
}
