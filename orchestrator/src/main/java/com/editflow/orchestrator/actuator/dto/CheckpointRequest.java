package com.editflow.orchestrator.actuator.dto;

/**
 * Request body for POST /checkpoint on the host bridge.
 */
public record CheckpointRequest(String subject_ref) {}
