package com.chicu.airetrain.web.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * targetVersionId == null: откат последнего промоушена.
 */
public record RollbackRequestDto(
        @Positive Long targetVersionId,
        @Size(max = 500) String reason
) {}
