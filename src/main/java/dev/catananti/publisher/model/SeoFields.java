package dev.catananti.publisher.model;

import lombok.Builder;

/**
 * Search and social preview metadata. Any field may be null.
 */
@Builder(toBuilder = true)
public record SeoFields(String description, String searchEngineTitle, String searchEngineDescription, String socialTitle) {

    private static final SeoFields EMPTY = new SeoFields(null, null, null, null);

    public static SeoFields empty() {
        return EMPTY;
    }
}
