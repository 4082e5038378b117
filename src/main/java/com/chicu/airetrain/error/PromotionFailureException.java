package com.chicu.airetrain.error;

public class PromotionFailureException extends ModelLifecycleException {

    public PromotionFailureException(String message, Throwable cause) {
        super(FailureKind.PROMOTION_FAILURE, message, cause);
    }
}
