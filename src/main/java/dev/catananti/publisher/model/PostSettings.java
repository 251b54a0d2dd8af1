package dev.catananti.publisher.model;

/**
 * Audience and comment settings resent with every merge.
 */
public record PostSettings(String audience, String commentPermissions, String commentSort) {

    public static final String EVERYONE = "everyone";
    public static final String BEST_FIRST = "best_first";

    private static final PostSettings DEFAULTS = new PostSettings(EVERYONE, EVERYONE, BEST_FIRST);

    public PostSettings {
        audience = audience == null || audience.isBlank() ? EVERYONE : audience;
        commentPermissions = commentPermissions == null || commentPermissions.isBlank() ? EVERYONE : commentPermissions;
        commentSort = commentSort == null || commentSort.isBlank() ? BEST_FIRST : commentSort;
    }

    public static PostSettings defaults() {
        return DEFAULTS;
    }
}
