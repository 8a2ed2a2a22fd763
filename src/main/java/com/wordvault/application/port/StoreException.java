package com.wordvault.application.port;

/** The lexical store could not complete an operation (SQL or document encoding failure). */
public class StoreException extends RuntimeException {
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
