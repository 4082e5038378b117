package com.chicu.airetrain.ml.sidecar.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainRequestDto {

    private String modelKey;

    private List<String> featureNames;

    @JsonProperty("X")
    private List<List<Double>> X;
    private List<Double> y;

    /** Бюджет обучения: sidecar должен уложиться сам. */
    private long timeBudgetMs;

    @Builder.Default
    private Map<String, Object> meta = Map.of();
}
