package com.example.cleanersched.exception;

import com.example.cleanersched.common.ApiResponse;
import com.example.cleanersched.common.error.ErrorLogBuffer;
import com.example.cleanersched.conflict.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ErrorLogBuffer errorLogBuffer;

    public GlobalExceptionHandler(ErrorLogBuffer errorLogBuffer) {
        this.errorLogBuffer = errorLogBuffer;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        ErrorResponse errorResponse = new ErrorResponse(
                "バリデーションエラー",
                "入力データに問題があります",
                errors,
                LocalDateTime.now()
        );

        logger.warn("バリデーションエラーが発生しました: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<ValidationResult>> handleConstraintViolation(ConstraintViolationException ex) {
        ValidationResult result = ex.getValidationResult();
        logger.info("スケジュール変更を拒否しました: {} (競合 {} 件)", ex.getMessage(),
                result == null ? 0 : result.conflicts().size());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.failure(ex.getMessage(), result));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "ビジネスロジックエラー",
                ex.getMessage(),
                Map.of("errorCode", ex.getErrorCode(), "parameters", Arrays.stream(ex.getParameters())
                        .map(String::valueOf).collect(Collectors.joining(","))),
                LocalDateTime.now()
        );

        logger.warn("ビジネスロジックエラーが発生しました: {} {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(errorResponse);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "引数エラー",
                ex.getMessage(),
                null,
                LocalDateTime.now()
        );

        logger.warn("引数エラーが発生しました: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "リクエスト形式エラー",
                "リクエストの形式が正しくありません",
                null,
                LocalDateTime.now()
        );

        logger.warn("リクエスト形式エラーが発生しました: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "内部サーバーエラー",
                "予期しないエラーが発生しました",
                null,
                LocalDateTime.now()
        );

        logger.error("予期しないエラーが発生しました", ex);
        errorLogBuffer.addError("GlobalExceptionHandler", "予期しないエラーが発生しました", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {}
}
