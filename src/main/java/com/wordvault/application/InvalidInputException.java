package com.wordvault.application;

/** A search term, prefix or paging parameter was rejected before any I/O took place. */
public class InvalidInputException extends RuntimeException {
  public InvalidInputException(String message) {
    super(message);
  }
}
