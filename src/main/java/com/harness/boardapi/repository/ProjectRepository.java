package com.harness.boardapi.repository;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectRepository extends JpaRepository<ProjectEntity, Integer> {

  List<ProjectEntity> findAllByOrderByIdAsc();
}
