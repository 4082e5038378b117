package com.chicu.airetrain.web.controller.api;

import com.chicu.airetrain.error.CoordinatorBusyException;
import com.chicu.airetrain.error.FailureKind;
import com.chicu.airetrain.error.ModelLifecycleException;
import com.chicu.airetrain.web.dto.ApiErrorBody;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * JSON-ошибки API. Таксономия оркестратора:
 * занятый координатор → 409, неудачный откат → 422, прочие сбои жизненного цикла → 500 с полем kind.
 */
@Slf4j
@RestControllerAdvice
public class ApiErrorHandler {

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class,
            HandlerMethodValidationException.class,
            ConstraintViolationException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ApiErrorBody> badRequest(Exception e, HttpServletRequest req) {
        log.warn("🚫 API 400 path={} err={}", path(req), e.toString());
        return respond(HttpStatus.BAD_REQUEST, e, null, req);
    }

    @ExceptionHandler(CoordinatorBusyException.class)
    public ResponseEntity<ApiErrorBody> busy(CoordinatorBusyException e, HttpServletRequest req) {
        log.warn("🚫 API 409 path={} msg={}", path(req), message(e));
        return respond(HttpStatus.CONFLICT, e, null, req);
    }

    @ExceptionHandler(ModelLifecycleException.class)
    public ResponseEntity<ApiErrorBody> lifecycle(ModelLifecycleException e, HttpServletRequest req) {
        FailureKind kind = e.getKind();
        HttpStatus status = kind == FailureKind.ROLLBACK_FAILURE
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.INTERNAL_SERVER_ERROR;

        log.error("🔥 API {} kind={} path={} msg={}", status.value(), kind, path(req), message(e));
        return respond(status, e, kind, req);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiErrorBody> methodNotAllowed(HttpRequestMethodNotSupportedException e, HttpServletRequest req) {
        log.warn("🚫 API 405 path={} method={}", path(req), e.getMethod());
        return respond(HttpStatus.METHOD_NOT_ALLOWED, e, null, req);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiErrorBody> responseStatus(ResponseStatusException e, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
        if (status.is5xxServerError()) {
            log.error("🔥 API {} path={} msg={}", status.value(), path(req), message(e), e);
        } else {
            log.warn("🚫 API {} path={} msg={}", status.value(), path(req), message(e));
        }
        return respond(status, e, null, req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorBody> unexpected(Exception e, HttpServletRequest req) {
        log.error("🔥 API 500 path={} msg={}", path(req), message(e), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e, null, req);
    }

    private ResponseEntity<ApiErrorBody> respond(HttpStatus status, Exception e, FailureKind kind, HttpServletRequest req) {
        ApiErrorBody body = ApiErrorBody.builder()
                .status("error")
                .code(status.value())
                .error(e.getClass().getSimpleName())
                .kind(kind != null ? kind.name() : null)
                .message(message(e))
                .path(path(req))
                .timestamp(System.currentTimeMillis())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    private static String message(Throwable e) {
        String m = e != null ? e.getMessage() : null;
        if (m != null && !m.isBlank()) return m;
        return e != null ? e.getClass().getSimpleName() : "Error";
    }

    private static String path(HttpServletRequest req) {
        return req != null ? req.getRequestURI() : "/";
    }
}
