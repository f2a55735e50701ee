package com.editflow.orchestrator.actuator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /dispatch.
 *
 * classification: "transient" | "resource" | "fatal" | null (on success)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchResponse(boolean ok, String error, String classification) {}
