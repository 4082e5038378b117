package com.chicu.airetrain.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Тело ошибки API. kind: только для сбоев жизненного цикла модели.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorBody(
        String status,
        int code,
        String error,
        String kind,
        String message,
        String path,
        long timestamp
) {}
