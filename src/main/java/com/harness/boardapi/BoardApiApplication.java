package com.harness.boardapi;

import com.harness.boardapi.crash.StartupFailureReporter;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BoardApiApplication {
  public static void main(String[] args) {
    try {
      SpringApplication.run(BoardApiApplication.class, args);
    } catch (Throwable startupFailure) {
      StartupFailureReporter.fromEnvironment(System.getenv()).report(startupFailure);
      System.exit(1);
    }
  }
}
