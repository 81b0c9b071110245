package com.harness.boardapi.controller;

import com.harness.boardapi.model.ProjectDto;
import com.harness.boardapi.service.ProjectService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/test")
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @GetMapping({"", "/"})
  public ResponseEntity<List<ProjectDto>> listProjects() {
    return ResponseEntity.ok(projectService.listProjects());
  }

  @PostMapping({"", "/"})
  public ResponseEntity<ProjectDto> createProject(@Valid @RequestBody ProjectDto request) {
    return ResponseEntity
        .status(HttpStatus.CREATED)
        .body(projectService.createProject(request));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProjectDto> getProject(@PathVariable Integer id) {
    return ResponseEntity.ok(projectService.getProject(id));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ProjectDto> updateProject(
      @PathVariable Integer id,
      @Valid @RequestBody ProjectDto request) {
    return ResponseEntity.ok(projectService.updateProject(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<MessageResponse> deleteProject(@PathVariable Integer id) {
    projectService.deleteProject(id);
    return ResponseEntity.ok(new MessageResponse("Deleted successfully"));
  }

  public record MessageResponse(String message) {}
}
