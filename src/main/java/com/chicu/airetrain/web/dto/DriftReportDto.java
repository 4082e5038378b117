package com.chicu.airetrain.web.dto;

import java.time.Instant;
import java.util.Map;

public record DriftReportDto(
        Instant timestamp,
        Double score,
        Map<String, Double> featureScores
) {}
