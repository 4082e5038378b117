package com.chicu.airetrain.web.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record DataRowsDto(
        List<String> featureNames,
        @NotNull List<Row> rows
) {
    public record Row(List<Double> features, Double label) {}
}
