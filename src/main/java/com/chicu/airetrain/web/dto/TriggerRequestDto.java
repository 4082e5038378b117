package com.chicu.airetrain.web.dto;

import jakarta.validation.constraints.Size;

public record TriggerRequestDto(
        @Size(max = 500) String note
) {}
