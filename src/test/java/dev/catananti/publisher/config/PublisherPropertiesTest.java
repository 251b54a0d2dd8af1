package dev.catananti.publisher.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PublisherPropertiesTest {

    @Test
    @DisplayName("Should strip scheme and trailing slash from hosts")
    void shouldNormalizeHosts() {
        PublisherProperties properties = new PublisherProperties(
                "https://pub.substack.com/", "substack.com", "sid", null, null, 100, "showWelcomeOnShare=true");

        assertThat(properties.getAccountHost()).isEqualTo("pub.substack.com");
        assertThat(properties.accountBaseUrl()).isEqualTo("https://pub.substack.com");
        assertThat(properties.globalBaseUrl()).isEqualTo("https://substack.com");
    }

    @Test
    @DisplayName("Should accept a bare session id")
    void shouldKeepBareCookie() {
        assertThat(PublisherProperties.normalizeCookie(" s%3Aabc.def ")).isEqualTo("s%3Aabc.def");
    }

    @Test
    @DisplayName("Should extract connect.sid from a pasted cookie header")
    void shouldExtractFromHeader() {
        assertThat(PublisherProperties.normalizeCookie("ajs_id=1; connect.sid=s%3Axyz; other=2"))
                .isEqualTo("s%3Axyz");
    }

    @Test
    @DisplayName("Should treat null settings as empty")
    void shouldHandleNulls() {
        assertThat(PublisherProperties.stripScheme(null)).isEmpty();
        assertThat(PublisherProperties.normalizeCookie(null)).isEmpty();
    }
}
