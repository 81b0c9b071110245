package com.harness.boardapi.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public ResponseEntity<StatusResponse> root() {
    return ResponseEntity.ok(new StatusResponse("Backend API is running", "ok", "/swagger", "/api/test"));
  }

  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(new HealthResponse("healthy", "Backend API"));
  }

  public record StatusResponse(String message, String status, String swagger, String api) {}

  public record HealthResponse(String status, String service) {}
}
