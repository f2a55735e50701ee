package com.editflow.orchestrator.resource;

/**
 * Source of resource samples for the {@link ResourceGovernor}.
 */
public interface ResourceSampler {

    ResourceSnapshot sample();
}
