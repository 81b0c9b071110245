package com.harness.boardapi.service;

import com.harness.boardapi.model.ProjectDto;
import com.harness.boardapi.repository.ProjectEntity;
import com.harness.boardapi.repository.ProjectRepository;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private final ProjectRepository repository;

  public ProjectService(ProjectRepository repository) {
    this.repository = repository;
  }

  @Transactional(readOnly = true)
  public List<ProjectDto> listProjects() {
    return repository.findAllByOrderByIdAsc().stream().map(this::toDto).toList();
  }

  @Transactional(readOnly = true)
  public ProjectDto getProject(int id) {
    return repository.findById(id)
        .map(this::toDto)
        .orElseThrow(() -> new ProjectNotFoundException(id));
  }

  @Transactional
  public ProjectDto createProject(ProjectDto request) {
    ProjectEntity saved = repository.save(new ProjectEntity(request.name()));
    return toDto(saved);
  }

  @Transactional
  public ProjectDto updateProject(int id, ProjectDto request) {
    ProjectEntity existing = repository.findById(id)
        .orElseThrow(() -> new ProjectNotFoundException(id));
    existing.setName(request.name());
    return toDto(repository.save(existing));
  }

  @Transactional
  public void deleteProject(int id) {
    ProjectEntity existing = repository.findById(id)
        .orElseThrow(() -> new ProjectNotFoundException(id));
    repository.delete(existing);
  }

  private ProjectDto toDto(ProjectEntity entity) {
    return new ProjectDto(entity.getId(), entity.getName());
  }
}
