package com.harness.boardapi.model;

public record ErrorResponse(String error, String message) {

  public static final String UNEXPECTED_FAILURE = "An error occurred while processing your request";

  public static ErrorResponse unexpected(String message) {
    return new ErrorResponse(UNEXPECTED_FAILURE, message);
  }
}
