package dev.catananti.publisher.model;

import lombok.Builder;
import lombok.Singular;

import java.util.List;

/**
 * Everything needed for one publish call. Built freely and validated only when
 * handed to the pipeline.
 */
@Builder(toBuilder = true)
public record PublishRequest(
        String title,
        String subtitle,
        String body,
        BodyFormat bodyFormat,
        AssetReference coverImage,
        Long categoryId,
        @Singular List<String> tags,
        SeoFields seo,
        PostSettings settings,
        boolean sendNotification,
        String shareText
) {

    public PublishRequest {
        body = body == null ? "" : body;
        bodyFormat = bodyFormat == null ? BodyFormat.HTML : bodyFormat;
        tags = tags == null ? List.of() : List.copyOf(tags);
        seo = seo == null ? SeoFields.empty() : seo;
        settings = settings == null ? PostSettings.defaults() : settings;
    }

    public boolean wantsShare() {
        return shareText != null && !shareText.isBlank();
    }
}
