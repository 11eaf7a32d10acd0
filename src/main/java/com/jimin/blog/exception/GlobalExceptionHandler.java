package com.jimin.blog.exception;

import com.jimin.blog.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * GlobalExceptionHandler - 전역 예외 처리
 *
 * @RestControllerAdvice: 모든 @RestController에 적용
 * CompletableFuture가 예외로 완료된 경우도 async dispatch에서 여기로 들어옴
 *
 * 모든 응답은 application/problem+json 형식의 ErrorResponse 하나
 *  - ResourceNotFoundException → 404
 *  - 검증 실패, 잘못된 요청 형식 → 400
 *  - 그 외 → 500 (상세 내용은 dev 프로필에서만)
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String NOT_FOUND_TITLE = "Resource Not Found";
    static final String VALIDATION_TITLE = "Validation Failed";
    static final String BAD_REQUEST_TITLE = "Malformed Request";
    static final String UNEXPECTED_TITLE = "An unexpected error occurred.";
    static final String UNEXPECTED_DETAIL =
            "The server encountered an error. Please try again or contact support.";

    private final Environment environment;

    public GlobalExceptionHandler(Environment environment) {
        this.environment = environment;
    }

    /**
     * ResourceNotFoundException 처리
     *
     * @return 404 Not Found, detail에 찾지 못한 ID 포함
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        log.warn("{} not found: {} (path: {})", ex.getResourceName(), ex.getResourceId(), request.getRequestURI());
        return problem(HttpStatus.NOT_FOUND,
                new ErrorResponse(HttpStatus.NOT_FOUND.value(), NOT_FOUND_TITLE, ex.getMessage(), request.getRequestURI()));
    }

    /**
     * Validation 에러 처리
     * @Valid 검증 실패 시 (예: @NotBlank, @TrimmedLength)
     *
     * @return 400 Bad Request, errors에 필드별 메시지
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationError(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        Map<String, List<String>> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.groupingBy(
                        FieldError::getField,
                        LinkedHashMap::new,
                        Collectors.mapping(FieldError::getDefaultMessage, Collectors.toList())
                ));

        log.warn("Validation failed for {}: {}", request.getRequestURI(), errors);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                VALIDATION_TITLE,
                "One or more validation errors occurred.",
                request.getRequestURI(),
                errors
        );
        return problem(HttpStatus.BAD_REQUEST, error);
    }

    /**
     * JSON 파싱 실패, UUID가 아닌 경로 변수 등
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        log.warn("Malformed request for {}: {}", request.getRequestURI(), ex.getMessage());

        String detail = ex instanceof MethodArgumentTypeMismatchException mismatch
                ? "Invalid value for parameter '" + mismatch.getName() + "'."
                : "Request body is missing or malformed.";

        return problem(HttpStatus.BAD_REQUEST,
                new ErrorResponse(HttpStatus.BAD_REQUEST.value(), BAD_REQUEST_TITLE, detail, request.getRequestURI()));
    }

    /**
     * 그 외 모든 예외 처리 (Fallback)
     *
     * @return 500 Internal Server Error
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(
            Exception ex,
            HttpServletRequest request
    ) {
        if (ex instanceof org.springframework.web.ErrorResponse frameworkError) {
            return handleFrameworkError(frameworkError, request);
        }

        log.error("Unhandled exception caught globally. Path: {}", request.getRequestURI(), ex);

        String detail = isDevelopment() ? describe(ex) : UNEXPECTED_DETAIL;

        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR.value(), UNEXPECTED_TITLE, detail, request.getRequestURI()));
    }

    /**
     * Spring MVC가 자체 상태 코드를 가진 예외 (없는 경로 404, 허용되지 않은 메서드 405 등)
     */
    private ResponseEntity<ErrorResponse> handleFrameworkError(
            org.springframework.web.ErrorResponse frameworkError,
            HttpServletRequest request
    ) {
        HttpStatusCode status = frameworkError.getStatusCode();
        log.warn("Request rejected with {}: {}", status.value(), request.getRequestURI());

        HttpStatus resolved = HttpStatus.resolve(status.value());
        String title = resolved != null ? resolved.getReasonPhrase() : "Request Failed";

        return ResponseEntity
                .status(status)
                .headers(frameworkError.getHeaders())
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(new ErrorResponse(status.value(), title, frameworkError.getBody().getDetail(), request.getRequestURI()));
    }

    private boolean isDevelopment() {
        return environment.acceptsProfiles(Profiles.of("dev"));
    }

    // 예외 타입, 메시지, 스택 트레이스 전체
    private static String describe(Throwable ex) {
        StringWriter writer = new StringWriter();
        ex.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private static ResponseEntity<ErrorResponse> problem(HttpStatus status, ErrorResponse body) {
        return ResponseEntity
                .status(status)
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(body);
    }
}
