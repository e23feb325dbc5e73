package com.example.draftarchiver.exceptions;

import com.example.draftarchiver.domain.FailureReason;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps lifecycle failures and request errors to RFC 7807 problem details.
 * Every body carries a {@code timestamp}; lifecycle failures also carry
 * {@code errorCode}, {@code stage} and {@code failedLocators}, and upload failures add
 * {@code transient} and {@code attempts}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String TIMESTAMP_PROPERTY = "timestamp";
    private static final String ERRORS_PROPERTY = "errors";
    private static final String ERROR_CODE_PROPERTY = "errorCode";
    private static final String STAGE_PROPERTY = "stage";
    private static final String DRAFT_ID_PROPERTY = "draftId";
    private static final String FAILED_LOCATORS_PROPERTY = "failedLocators";
    private static final String TRANSIENT_PROPERTY = "transient";
    private static final String ATTEMPTS_PROPERTY = "attempts";

    private static final Map<String, HttpStatus> STATUS_BY_ERROR_CODE = Map.of(
            "TemplateNotFound", HttpStatus.NOT_FOUND,
            "WorkspaceAlreadyExists", HttpStatus.CONFLICT,
            "ProvisionIOError", HttpStatus.INTERNAL_SERVER_ERROR,
            "AssetFetchError", HttpStatus.BAD_GATEWAY,
            "WorkspaceNotReady", HttpStatus.INTERNAL_SERVER_ERROR,
            "ArchiveError", HttpStatus.INTERNAL_SERVER_ERROR,
            "UploadError", HttpStatus.BAD_GATEWAY,
            "CancelledError", HttpStatus.CONFLICT,
            "UnexpectedError", HttpStatus.INTERNAL_SERVER_ERROR
    );

    // --- Lifecycle failures ---

    @ExceptionHandler(DraftArchiveFailedException.class)
    public ProblemDetail handleDraftArchiveFailed(DraftArchiveFailedException ex, WebRequest request) {
        FailureReason reason = ex.getReason();
        HttpStatus status = statusFor(reason.errorCode());
        if (status.is5xxServerError()) {
            log.error("Draft archive run for {} failed with {} in {}: {} (cause: {})",
                    ex.getDraftId(), reason.errorCode(), reason.stage(), reason.message(), reason.cause());
        } else {
            log.warn("Draft archive run for {} rejected with {}: {}", ex.getDraftId(), reason.errorCode(), reason.message());
        }

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, reason.message());
        problemDetail.setTitle(status.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(DRAFT_ID_PROPERTY, ex.getDraftId());
        problemDetail.setProperty(ERROR_CODE_PROPERTY, reason.errorCode());
        problemDetail.setProperty(STAGE_PROPERTY, reason.stage());
        problemDetail.setProperty(FAILED_LOCATORS_PROPERTY, reason.failedLocators());
        if (reason.transientFailure() != null) {
            problemDetail.setProperty(TRANSIENT_PROPERTY, reason.transientFailure());
        }
        if (reason.attempts() != null) {
            problemDetail.setProperty(ATTEMPTS_PROPERTY, reason.attempts());
        }
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    @ExceptionHandler(DraftLifecycleException.class)
    public ProblemDetail handleDraftLifecycleException(DraftLifecycleException ex, WebRequest request) {
        HttpStatus status = statusFor(ex.getErrorCode());
        log.error("Draft lifecycle operation failed with {}: {}", ex.getErrorCode(), ex.getMessage(), ex);

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle(status.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(ERROR_CODE_PROPERTY, ex.getErrorCode());
        if (ex instanceof AssetFetchException fetchFailure) {
            problemDetail.setProperty(FAILED_LOCATORS_PROPERTY, fetchFailure.getFailedLocators());
        } else if (ex instanceof UploadException uploadFailure) {
            problemDetail.setProperty(TRANSIENT_PROPERTY, uploadFailure.isTransientFailure());
            problemDetail.setProperty(ATTEMPTS_PROPERTY, uploadFailure.getAttempts());
        }
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    // --- Request validation ---

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgumentException(IllegalArgumentException ex, WebRequest request) {
        log.warn("Invalid request {}: {}", request.getDescription(false), ex.getMessage());
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problemDetail.setTitle(HttpStatus.BAD_REQUEST.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException ex, WebRequest request) {
        log.warn("Constraint violation for request {}: {}", request.getDescription(false), ex.getMessage());

        Map<String, String> errors = ex.getConstraintViolations().stream()
                .collect(Collectors.toMap(
                        violation -> getPropertyName(violation.getPropertyPath().toString()),
                        ConstraintViolation::getMessage,
                        (first, second) -> first
                ));

        ProblemDetail problemDetail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        problemDetail.setTitle(HttpStatus.BAD_REQUEST.getReasonPhrase());
        problemDetail.setDetail("Input validation failed. Check the 'errors' field for details.");
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        log.warn("Request body validation failed for {}: {}", request.getDescription(false), ex.getMessage());
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ProblemDetail problemDetail = ProblemDetail.forStatus(status);
        problemDetail.setTitle(getReasonPhrase(status, "Validation Failed"));
        problemDetail.setDetail("Request body validation failed. Check the 'errors' field for details.");
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return new ResponseEntity<>(problemDetail, headers, status);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handleResponseStatusException(ResponseStatusException ex, WebRequest request) {
        log.info("Handling ResponseStatusException for {}: Status={}, Reason={}",
                request.getDescription(false), ex.getStatusCode(), ex.getReason());
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        problemDetail.setTitle(getReasonPhrase(ex.getStatusCode(), "Status"));
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    // --- Fallback ---

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Unhandled exception for request {}:", request.getDescription(false), ex);
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected internal error occurred. Please try again later or contact support."
        );
        problemDetail.setTitle(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(ERROR_CODE_PROPERTY, "UnexpectedError");
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    /**
     * Adds the timestamp and instance to problem bodies built by the base class
     * for standard Spring MVC exceptions.
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex, @Nullable Object body, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode, @NonNull WebRequest request) {

        ProblemDetail problemDetail;
        if (body instanceof ProblemDetail existing) {
            problemDetail = existing;
        } else {
            log.warn("Creating basic ProblemDetail for exception type {}: {}",
                    ex.getClass().getSimpleName(), ex.getMessage());
            problemDetail = ProblemDetail.forStatusAndDetail(statusCode, ex.getMessage());
        }
        if (problemDetail.getTitle() == null) {
            problemDetail.setTitle(getReasonPhrase(statusCode, "Status"));
        }
        if (problemDetail.getInstance() == null) {
            problemDetail.setInstance(URI.create(request.getDescription(false)));
        }
        Map<String, Object> properties = problemDetail.getProperties();
        if (properties == null || !properties.containsKey(TIMESTAMP_PROPERTY)) {
            problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        }
        return new ResponseEntity<>(problemDetail, headers, statusCode);
    }

    static HttpStatus statusFor(String errorCode) {
        return STATUS_BY_ERROR_CODE.getOrDefault(errorCode, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private String getPropertyName(String propertyPath) {
        if (propertyPath == null || propertyPath.isEmpty()) {
            return "unknown";
        }
        int lastSeparator = Math.max(propertyPath.lastIndexOf('.'), propertyPath.lastIndexOf('['));
        return (lastSeparator == -1) ? propertyPath : propertyPath.substring(lastSeparator + 1);
    }

    private String getReasonPhrase(HttpStatusCode statusCode, String fallbackTitle) {
        if (statusCode instanceof HttpStatus httpStatus) {
            return httpStatus.getReasonPhrase();
        }
        HttpStatus resolved = HttpStatus.resolve(statusCode.value());
        return resolved != null ? resolved.getReasonPhrase() : fallbackTitle;
    }
}
