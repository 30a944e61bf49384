package com.starscape.bracketflow.features.dispatch.domain;

public interface ManifestStore {
    
    /**
     * Persists the manifest document where the compute provider can read it.
     *
     * @return the storage key the provider is given
     */
    String store(String jobId, Manifest manifest);
}
