package com.chicu.airetrain.version;

import java.time.Instant;

/**
 * Один промоушен: кого архивировали, кого сделали Active.
 */
public record PromotionStep(Long previousId, long promotedId, Instant promotedAt) {}
