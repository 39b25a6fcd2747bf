package com.example.lifegarden.api;

import com.example.lifegarden.exception.InvalidConfigException;
import com.example.lifegarden.exception.UnknownArealException;
import com.example.lifegarden.exception.UnknownPlantException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@Slf4j
@RestControllerAdvice(basePackages = "com.example.lifegarden.api")
public class ApiExceptionAdvice {

  @ExceptionHandler(InvalidConfigException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidConfig(InvalidConfigException e) {
    return body(HttpStatus.BAD_REQUEST, "INVALID_CONFIG", e.getMessage());
  }

  @ExceptionHandler({UnknownPlantException.class, UnknownArealException.class})
  public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException e) {
    return body(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleIllegalArg(IllegalArgumentException e) {
    String msg = (e.getMessage() == null) ? "Illegal argument" : e.getMessage();
    return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", msg);
  }

  @ExceptionHandler({
      HttpMessageNotReadableException.class,
      MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class,
      MissingServletRequestParameterException.class
  })
  public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
    return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, Object>> handleStorage(DataAccessException e) {
    log.error("Garden storage failure: {}", e.getMessage(), e);
    return body(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_UNAVAILABLE", "Garden storage is unavailable");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception e) {
    log.error("Unexpected error: {}", e.getMessage(), e);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error");
  }

  private ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(Map.of(
        "code", code,
        "message", message
    ));
  }
}
