package dev.catananti.publisher.service;

import dev.catananti.publisher.model.AssetReference;
import reactor.core.publisher.Mono;

/**
 * Turns an asset reference into a URL the platform can host.
 */
public interface AssetResolver {

    /**
     * Resolve an asset for a draft.
     *
     * @param reference  inline payload or already-hosted URL
     * @param forDraftId the draft the asset is uploaded against
     * @return the hosted URL; a {@link AssetReference.Remote} input is returned as-is
     */
    Mono<AssetReference.Remote> resolve(AssetReference reference, long forDraftId);
}
