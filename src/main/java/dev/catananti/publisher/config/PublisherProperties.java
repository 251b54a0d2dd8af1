package dev.catananti.publisher.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Platform coordinates and publishing defaults, injected once at startup.
 * The default section applies only when a request does not name its own.
 */
@Component
@Getter
@Slf4j
public class PublisherProperties {

    private final String accountHost;
    private final String globalHost;
    private final String sessionCookie;
    private final Long authorId;
    private final Long defaultSectionId;
    private final long maxUploadBytes;
    private final String shareTrackingParameter;

    public PublisherProperties(
            @Value("${publisher.account-host:}") String accountHost,
            @Value("${publisher.global-host:substack.com}") String globalHost,
            @Value("${publisher.session-cookie:}") String sessionCookie,
            @Value("${publisher.author-id:#{null}}") Long authorId,
            @Value("${publisher.default-section-id:#{null}}") Long defaultSectionId,
            @Value("${publisher.upload.max-size:10485760}") long maxUploadBytes,
            @Value("${publisher.share.tracking-parameter:showWelcomeOnShare=true}") String shareTrackingParameter) {
        this.accountHost = stripScheme(accountHost);
        this.globalHost = stripScheme(globalHost);
        this.sessionCookie = normalizeCookie(sessionCookie);
        this.authorId = authorId;
        this.defaultSectionId = defaultSectionId;
        this.maxUploadBytes = maxUploadBytes;
        this.shareTrackingParameter = shareTrackingParameter;

        if (this.accountHost.isEmpty()) {
            log.warn("publisher.account-host is not set; draft calls will fail");
        } else {
            log.info("Publishing to account host={}, global host={}, defaultSection={}",
                    this.accountHost, this.globalHost, defaultSectionId);
        }
    }

    public String accountBaseUrl() {
        return "https://" + accountHost;
    }

    public String globalBaseUrl() {
        return "https://" + globalHost;
    }

    static String stripScheme(String host) {
        if (host == null) {
            return "";
        }
        String trimmed = host.trim().replaceFirst("^https?://", "");
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /**
     * Accepts the bare session id or a pasted {@code connect.sid=...; ...} header value.
     */
    static String normalizeCookie(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim();
        int newline = value.indexOf('\n');
        if (newline >= 0) {
            value = value.substring(0, newline).trim();
        }
        int start = value.indexOf("connect.sid=");
        if (start >= 0) {
            value = value.substring(start + "connect.sid=".length());
            int end = value.indexOf(';');
            if (end >= 0) {
                value = value.substring(0, end);
            }
        }
        return value.trim();
    }
}
