package dev.catananti.publisher.dto;

import dev.catananti.publisher.model.AssetReference;
import dev.catananti.publisher.model.BodyFormat;
import dev.catananti.publisher.model.PostSettings;
import dev.catananti.publisher.model.PublishRequest;
import dev.catananti.publisher.model.SeoFields;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishPostRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 500, message = "Title must be at most 500 characters")
    private String title;

    @Size(max = 500, message = "Subtitle must be at most 500 characters")
    private String subtitle;

    @Size(max = 500000, message = "Body must be at most 500000 characters")
    private String body;

    @Pattern(regexp = "^(HTML|MARKDOWN)?$", message = "Body format must be HTML or MARKDOWN")
    private String bodyFormat;

    /**
     * Either an http(s) URL or a {@code data:image/...;base64,} URI.
     */
    @Pattern(regexp = "^((https?://|data:image/).*)?$", message = "Cover image must be an HTTP(S) URL or a base64 image data URI")
    private String coverImage;

    @Positive(message = "Category id must be positive")
    private Long categoryId;

    @Size(max = 20, message = "Maximum 20 tags allowed")
    private List<String> tags;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;

    @Size(max = 255, message = "SEO title must be at most 255 characters")
    private String seoTitle;

    @Size(max = 500, message = "SEO description must be at most 500 characters")
    private String seoDescription;

    @Size(max = 255, message = "Social title must be at most 255 characters")
    private String socialTitle;

    @Pattern(regexp = "^(everyone|only_paid|founding|only_free)?$", message = "Audience must be everyone, only_paid, founding or only_free")
    private String audience;

    private String commentPermissions;

    private String commentSort;

    private boolean sendNotification;

    @Size(max = 1000, message = "Share text must be at most 1000 characters")
    private String shareText;

    public PublishRequest toPublishRequest() {
        return PublishRequest.builder()
                .title(title)
                .subtitle(subtitle)
                .body(body)
                .bodyFormat(bodyFormat == null || bodyFormat.isBlank() ? BodyFormat.HTML : BodyFormat.valueOf(bodyFormat))
                .coverImage(coverImage == null || coverImage.isBlank() ? null : AssetReference.parse(coverImage))
                .categoryId(categoryId)
                .tags(tags == null ? List.of() : tags)
                .seo(SeoFields.builder()
                        .description(description)
                        .searchEngineTitle(seoTitle)
                        .searchEngineDescription(seoDescription)
                        .socialTitle(socialTitle)
                        .build())
                .settings(new PostSettings(audience, commentPermissions, commentSort))
                .sendNotification(sendNotification)
                .shareText(shareText)
                .build();
    }
}
