package com.wordvault.dto;

/**
 * Error body returned by every endpoint.
 *
 * @param type machine-readable kind, one of the {@code TYPE_*} constants
 */
public record ErrorMessage(String type, String message) {
  public static final String TYPE_INVALID_INPUT = "invalid_input";
  public static final String TYPE_NOT_FOUND = "not_found";
  public static final String TYPE_FETCH_ERROR = "fetch_error";
  public static final String TYPE_STORE_ERROR = "store_error";
}
