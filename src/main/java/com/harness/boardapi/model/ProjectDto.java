package com.harness.boardapi.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Wire form of a project row. Property names keep the table's capitalised column names.
 */
public record ProjectDto(
    @JsonProperty("Id") Integer id,
    @JsonProperty("Name") @NotBlank String name
) {}
