package com.wordvault.interfaces.rest;

import com.wordvault.application.FetchException;
import com.wordvault.application.InvalidInputException;
import com.wordvault.application.port.StoreException;
import com.wordvault.dto.ErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps service exceptions to {@link ErrorMessage} bodies and HTTP status codes. */
@RestControllerAdvice
public class RestExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

  @ExceptionHandler(InvalidInputException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onInvalidInput(InvalidInputException e) {
    return new ErrorMessage(ErrorMessage.TYPE_INVALID_INPUT, e.getMessage());
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onBadRequest(Exception e) {
    log.debug("Rejected request: {}", e.getMessage());
    return new ErrorMessage(ErrorMessage.TYPE_INVALID_INPUT, "Malformed request");
  }

  @ExceptionHandler(FetchException.class)
  @ResponseStatus(HttpStatus.BAD_GATEWAY)
  public ErrorMessage onFetch(FetchException e) {
    log.warn("Lookup aborted: {}", e.getMessage());
    return new ErrorMessage(ErrorMessage.TYPE_FETCH_ERROR, e.getMessage());
  }

  @ExceptionHandler(StoreException.class)
  @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
  public ErrorMessage onStore(StoreException e) {
    log.error("Store failure", e);
    return new ErrorMessage(ErrorMessage.TYPE_STORE_ERROR, e.getMessage());
  }
}
