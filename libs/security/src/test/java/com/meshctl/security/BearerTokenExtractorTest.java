package com.meshctl.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for BearerTokenExtractor.
 *
 * WHY: the bearer fallback turns the token into a tenant ID, so a sloppy prefix match
 * would hand out identities for malformed headers.
 */
@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Nested
    @DisplayName("valid headers")
    class ValidHeaders {

        @Test
        @DisplayName("extracts token from 'Bearer xxx' header")
        void extractsToken() {
            assertThat(BearerTokenExtractor.extract("Bearer tenant-abc")).contains("tenant-abc");
        }

        @Test
        @DisplayName("handles extra whitespace after Bearer")
        void handlesExtraWhitespace() {
            assertThat(BearerTokenExtractor.extract("  Bearer   my-token  ")).contains("my-token");
        }

        @Test
        @DisplayName("is case-insensitive for the scheme")
        void caseInsensitive() {
            assertThat(BearerTokenExtractor.extract("bearer t1")).contains("t1");
            assertThat(BearerTokenExtractor.extract("BEARER t1")).contains("t1");
        }
    }

    @Nested
    @DisplayName("invalid headers")
    class InvalidHeaders {

        @Test
        @DisplayName("returns empty for null or blank header")
        void nullOrBlankHeader() {
            assertThat(BearerTokenExtractor.extract(null)).isEmpty();
            assertThat(BearerTokenExtractor.extract("   ")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for 'Basic' auth scheme")
        void basicScheme() {
            assertThat(BearerTokenExtractor.extract("Basic dXNlcjpwYXNz")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for 'Bearer' with no token")
        void bearerNoToken() {
            assertThat(BearerTokenExtractor.extract("Bearer ")).isEmpty();
            assertThat(BearerTokenExtractor.extract("Bearer")).isEmpty();
        }

        @Test
        @DisplayName("returns empty when the scheme is glued to the token")
        void schemeWithoutSeparator() {
            assertThat(BearerTokenExtractor.extract("Bearertenant-abc")).isEmpty();
        }
    }
}
