package com.editflow.orchestrator.api.dto;

/** Request body for PATCH /jobs/{id}/priority. Out-of-range tiers are clamped to 1..3. */
public record TierRequest(int priorityTier) {}
