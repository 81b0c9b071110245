package com.harness.boardapi.service;

public class ProjectNotFoundException extends RuntimeException {

  private final int projectId;

  public ProjectNotFoundException(int projectId) {
    super("Project not found");
    this.projectId = projectId;
  }

  public int getProjectId() {
    return projectId;
  }
}
