/*
 * どこで: Events API
 * 何を: 通知/監査 API の例外を HTTP ステータスとエラーコードへ写像する
 * なぜ: NotFound と I/O 失敗を区別してクライアントへ返すため
 */
package com.handreceipt.events.api;

import com.handreceipt.events.ledger.LedgerUnavailableException;
import com.handreceipt.events.service.AuditEventNotFoundException;
import com.handreceipt.events.service.NotificationNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(NotificationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotificationNotFound(
      NotificationNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("NOTIFICATION_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(AuditEventNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleAuditEventNotFound(AuditEventNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("AUDIT_EVENT_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MethodArgumentTypeMismatchException.class,
    MissingRequestHeaderException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("EVENTS_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(LedgerUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleLedgerUnavailable(LedgerUnavailableException ex) {
    logger.error("audit ledger unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("AUDIT_LEDGER_UNAVAILABLE", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("EVENTS_INTERNAL_ERROR", ex.getMessage()));
  }
}
