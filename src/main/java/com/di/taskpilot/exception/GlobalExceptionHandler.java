package com.di.taskpilot.exception;

import com.di.taskpilot.learner.KnowledgeStoreException;
import com.di.taskpilot.metrics.MetricsStoreException;
import com.di.taskpilot.util.MdcPropagation;
import jakarta.servlet.http.HttpServletRequest;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps exceptions escaping the management controllers to a JSON {@link ErrorResponse}. Modeled outcomes
 * (rejections, throttling, missing tasks) never reach this handler; they are returned as values.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class,
            MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e, HttpServletRequest request) {
        return respond("VALIDATION_EXCEPTION", FailureCategory.INVALID_INPUT, e, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler({MetricsStoreException.class, KnowledgeStoreException.class})
    public ResponseEntity<ErrorResponse> handleStoreException(RuntimeException e, HttpServletRequest request) {
        return respond("STORE_EXCEPTION", FailureCategory.STORAGE_ERROR, e, HttpStatus.SERVICE_UNAVAILABLE, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        return respond("UNHANDLED_EXCEPTION", FailureCategory.categorize(e), e, HttpStatus.INTERNAL_SERVER_ERROR,
                request);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, FailureCategory category, Exception e,
                                                  HttpStatus status, HttpServletRequest request) {
        String errorId = errorId();
        if (status.is5xxServerError()) {
            log.error("[API] {} {} [{}] errorId={}", eventType, e.getClass().getSimpleName(), category.getName(),
                    errorId, e);
        } else {
            log.warn("[API] {} {}: {} errorId={}", eventType, e.getClass().getSimpleName(), e.getMessage(), errorId);
        }
        return ResponseEntity.status(status).body(buildErrorResponse(errorId, category, e, status, request));
    }

    private ErrorResponse buildErrorResponse(String errorId, FailureCategory category, Throwable exception,
                                             HttpStatus status, HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse();
        response.setErrorId(errorId);
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(request != null ? request.getRequestURI() : "/unknown");
        response.getDetails().put("exceptionType", exception.getClass().getName());
        Throwable rootCause = rootCause(exception);
        if (rootCause != exception) {
            response.getDetails().put("rootCauseType", rootCause.getClass().getName());
            response.getDetails().put("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static String errorId() {
        String taskId = MDC.get(MdcPropagation.TASK_ID);
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return taskId != null ? taskId + "-" + suffix : "api-" + suffix;
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    @Data
    public static class ErrorResponse {
        private String errorId;
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();
    }
}
