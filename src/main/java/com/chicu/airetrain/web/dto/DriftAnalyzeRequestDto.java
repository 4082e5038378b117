package com.chicu.airetrain.web.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/**
 * Колонки фич: name → значения. Пустой method берётся из конфигурации.
 * record=true: отчёт сразу пишется в монитор.
 */
public record DriftAnalyzeRequestDto(
        @NotEmpty Map<String, List<Double>> baseline,
        @NotEmpty Map<String, List<Double>> current,
        String method,
        boolean record
) {}
