package com.fenci.infrastructure.ai;

import com.fenci.domain.segment.model.LinkSpan;
import com.fenci.domain.segment.model.LinkType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LinkExtractorTest {

    private static final String DEFAULT_PROTOCOL = "https://";

    private LinkExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new LinkExtractor();
    }

    // ── Literal URLs ──

    @Nested
    @DisplayName("Literal URLs")
    class LiteralUrls {

        @Test
        void https_url() {
            List<LinkSpan> spans = extractor.extract("see https://example.com/path?q=1 now", DEFAULT_PROTOCOL);

            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).originalText()).isEqualTo("https://example.com/path?q=1");
            assertThat(spans.get(0).type()).isEqualTo(LinkType.LITERAL);
            assertThat(spans.get(0).placeholder()).isEqualTo("{{LINK_0}}");
            assertThat(spans.get(0).startPos()).isEqualTo(4);
        }

        @Test
        @DisplayName("A domain inside a literal URL is not reported twice")
        void no_duplicate_suspect() {
            assertThat(extractor.extract("http://a.com", DEFAULT_PROTOCOL)).hasSize(1);
        }
    }

    // ── Suspect links ──

    @Nested
    @DisplayName("Suspect links")
    class SuspectLinks {

        @Test
        void completed_with_default_protocol() {
            List<LinkSpan> spans = extractor.extract("visit example.com today", DEFAULT_PROTOCOL);

            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).type()).isEqualTo(LinkType.SUSPECT);
            assertThat(spans.get(0).url()).isEqualTo("https://example.com");
        }

        @Test
        @DisplayName("Protocol is inherited from the nearest preceding literal URL")
        void inherits_preceding_protocol() {
            List<LinkSpan> spans = extractor.extract("ftp://files.net/a then docs.io", DEFAULT_PROTOCOL);

            assertThat(spans).extracting(LinkSpan::url)
                    .containsExactly("ftp://files.net/a", "ftp://docs.io");
            assertThat(spans).extracting(LinkSpan::placeholder)
                    .containsExactly("{{LINK_0}}", "{{LINK_1}}");
        }

        @Test
        void email_domain_ignored() {
            assertThat(extractor.extract("mail me@mail.com", DEFAULT_PROTOCOL)).isEmpty();
        }

        @Test
        void excluded_first_label() {
            assertThat(extractor.extract("see version.io and figure.co", DEFAULT_PROTOCOL)).isEmpty();
        }
    }

    @Test
    void empty_input() {
        assertThat(extractor.extract("", DEFAULT_PROTOCOL)).isEmpty();
        assertThat(extractor.extract(null, DEFAULT_PROTOCOL)).isEmpty();
    }
}
