/*
 * どこで: Importer API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: エラー応答の code / message を全エンドポイントで揃えるため
 */
package com.example.importer.api;

import com.example.importer.job.JobNotFoundException;
import com.example.importer.product.InvalidProductException;
import com.example.importer.product.ProductConflictException;
import com.example.importer.product.ProductNotFoundException;
import com.example.importer.webhook.InvalidWebhookException;
import com.example.importer.webhook.WebhookNotFoundException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleJobNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND", ex.getMessage());
  }

  @ExceptionHandler(ProductNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleProductNotFound(ProductNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "PRODUCT_NOT_FOUND", ex.getMessage());
  }

  @ExceptionHandler(WebhookNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleWebhookNotFound(WebhookNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "WEBHOOK_NOT_FOUND", ex.getMessage());
  }

  @ExceptionHandler(ProductConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleProductConflict(ProductConflictException ex) {
    return error(HttpStatus.CONFLICT, "PRODUCT_SKU_CONFLICT", ex.getMessage());
  }

  @ExceptionHandler({
    InvalidProductException.class,
    InvalidWebhookException.class,
    InvalidUploadException.class
  })
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(RuntimeException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
    return error(HttpStatus.PAYLOAD_TOO_LARGE, "UPLOAD_TOO_LARGE", "uploaded file is too large");
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
    return badRequest(ex.getRequestPartName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "internal error");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message);
  }

  private ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
