package com.harness.boardapi.crash;

public enum FailureKind {
  PANIC("panic"),
  ERROR("error");

  private final String wireValue;

  FailureKind(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }
}
