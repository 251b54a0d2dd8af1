package dev.catananti.publisher.model;

/**
 * Remote steps of the publish flow, used to tag failures.
 */
public enum PublishStage {
    CREATE_DRAFT("CreateDraft"),
    FETCH_DRAFT("FetchDraft"),
    UPLOAD_ASSET("UploadAsset"),
    MERGE_CONTENT("MergeContent"),
    PUBLISH("Publish"),
    DELETE_DRAFT("DeleteDraft"),
    SHARE_AS_NOTE("ShareAsNote");

    private final String displayName;

    PublishStage(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
