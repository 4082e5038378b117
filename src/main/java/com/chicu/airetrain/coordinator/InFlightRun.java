package com.chicu.airetrain.coordinator;

import com.chicu.airetrain.error.FailureKind;
import com.chicu.airetrain.error.ModelLifecycleException;
import com.chicu.airetrain.error.ResourceExceededException;
import com.chicu.airetrain.error.RetrainingAbortedException;
import com.chicu.airetrain.trigger.RetrainingRequest;
import lombok.Getter;

import java.util.concurrent.Future;

/**
 * Текущий прогон координатора: заявка, future обучения и флаг прерывания.
 * Прерывание первым выигрывает, повторные запросы игнорируются.
 */
class InFlightRun {

    @Getter
    private final RetrainingRequest request;

    private Future<?> trainingFuture;
    private FailureKind abortKind;
    private String abortReason;

    InFlightRun(RetrainingRequest request) {
        this.request = request;
    }

    synchronized void attachTraining(Future<?> future) {
        this.trainingFuture = future;
        if (abortKind != null) future.cancel(true);
    }

    synchronized void detachTraining() {
        this.trainingFuture = null;
    }

    /**
     * @return true, если это первый запрос на прерывание
     */
    synchronized boolean requestAbort(FailureKind kind, String reason) {
        if (abortKind != null) return false;
        this.abortKind = kind;
        this.abortReason = reason;
        if (trainingFuture != null) trainingFuture.cancel(true);
        return true;
    }

    synchronized boolean isAbortRequested() {
        return abortKind != null;
    }

    synchronized ModelLifecycleException abortException() {
        if (abortKind == FailureKind.RESOURCE_EXCEEDED) {
            return new ResourceExceededException(abortReason);
        }
        return new RetrainingAbortedException(abortReason != null ? abortReason : "aborted");
    }
}
