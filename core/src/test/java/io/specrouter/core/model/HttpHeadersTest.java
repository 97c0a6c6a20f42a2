package io.specrouter.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link HttpHeaders}. */
class HttpHeadersTest {

    // ── Case-insensitive lookup ──

    @Test
    void firstIsCaseInsensitive() {
        HttpHeaders headers = HttpHeaders.of(Map.of("X-Authorization-Provider", "bank"));
        assertThat(headers.first("x-authorization-provider")).isEqualTo("bank");
        assertThat(headers.first("X-AUTHORIZATION-PROVIDER")).isEqualTo("bank");
        assertThat(headers.contains("x-Authorization-provider")).isTrue();
    }

    @Test
    void missingHeader() {
        HttpHeaders headers = HttpHeaders.of(Map.of("Accept", "application/json"));
        assertThat(headers.first("Authorization")).isNull();
        assertThat(headers.all("Authorization")).isEmpty();
    }

    @Test
    void multipleValues() {
        HttpHeaders headers = HttpHeaders.ofMulti(Map.of("x-consent-token", List.of("a", "b")));
        assertThat(headers.first("X-Consent-Token")).isEqualTo("a");
        assertThat(headers.all("X-Consent-Token")).containsExactly("a", "b");
    }

    // ── Views ──

    @Test
    void singleValueMapHasLowercaseKeys() {
        HttpHeaders headers = HttpHeaders.of(Map.of("Authorization", "Bearer t"));
        assertThat(headers.toSingleValueMap()).containsExactly(Map.entry("authorization", "Bearer t"));
    }

    @Test
    void emptyFactories() {
        assertThat(HttpHeaders.of(null).isEmpty()).isTrue();
        assertThat(HttpHeaders.ofMulti(Map.of())).isSameAs(HttpHeaders.empty());
    }

    @Test
    void equalityIgnoresInputCase() {
        assertThat(HttpHeaders.of(Map.of("Authorization", "x")))
                .isEqualTo(HttpHeaders.of(Map.of("authorization", "x")));
    }
}
