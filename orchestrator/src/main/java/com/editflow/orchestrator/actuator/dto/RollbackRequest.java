package com.editflow.orchestrator.actuator.dto;

/**
 * Request body for POST /rollback.
 */
public record RollbackRequest(String handle) {}
