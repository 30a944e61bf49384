package com.starscape.bracketflow.features.dispatch.domain;

/**
 * External compute service that runs workflows over a manifest.
 */
public interface ComputeProviderClient {
    
    /**
     * Starts a run and returns the provider's opaque execution handle.
     *
     * @throws ComputeProviderException when the provider is unreachable or refuses the run
     */
    String submit(ComputeSubmission submission);
}
