package com.chicu.airetrain.ml.sidecar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictResponseDto {

    private boolean ok;

    /** по строке X: одно значение (label или prob) */
    @Builder.Default
    private List<Double> predictions = List.of();

    private String message;
}
