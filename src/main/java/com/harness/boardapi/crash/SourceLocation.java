package com.harness.boardapi.crash;

/**
 * File name and line of the frame a failure is attributed to.
 */
public record SourceLocation(String file, int line) {}
