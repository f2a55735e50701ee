package com.editflow.orchestrator.actuator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /checkpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckpointResponse(String handle) {}
