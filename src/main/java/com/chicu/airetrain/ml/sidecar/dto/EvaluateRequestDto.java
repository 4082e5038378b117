package com.chicu.airetrain.ml.sidecar.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateRequestDto {

    private String modelPath;

    private List<String> featureNames;

    @JsonProperty("X")
    private List<List<Double>> X;

    /** null для /predict */
    private List<Double> y;
}
