package com.editflow.orchestrator.actuator.dto;

/**
 * Request body for POST /dispatch.
 * {@code config} is forwarded exactly as it was submitted.
 */
public record DispatchRequest(String subject_ref, String config) {}
