package com.agentsearch.service.fetch;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.PageContent;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupPageFetcherTest {

    private static final String URL = "https://example.com/articles/tariffs";

    private AgentSearchProperties properties;

    private JsoupPageFetcher fetcher;

    @BeforeEach
    void setUp() {
        properties = new AgentSearchProperties();
        fetcher = new JsoupPageFetcher(properties);
    }

    private PageContent parse(String html) {
        return fetcher.parse(URL, Jsoup.parse(html, URL), "text/html");
    }

    @Nested
    @DisplayName("Title")
    class Title {

        @Test
        @DisplayName("The document title wins")
        void documentTitle() {
            PageContent page = parse("<html><head><title> Tariffs 2024 </title></head><body><h1>Heading</h1></body></html>");

            assertThat(page.getTitle()).isEqualTo("Tariffs 2024");
        }

        @Test
        @DisplayName("Falls back to the first heading")
        void heading() {
            PageContent page = parse("<html><body><h1>Heading</h1><p>text</p></body></html>");

            assertThat(page.getTitle()).isEqualTo("Heading");
        }

        @Test
        @DisplayName("Falls back to the last path segment")
        void pathSegment() {
            PageContent page = parse("<html><body><p>text</p></body></html>");

            assertThat(page.getTitle()).isEqualTo("tariffs");
        }
    }

    @Nested
    @DisplayName("Content")
    class Content {

        @Test
        @DisplayName("Navigation, scripts and footers are stripped")
        void stripsNoise() {
            // Given
            String html = "<html><body>"
                + "<nav>Home | About</nav>"
                + "<script>var x = 1;</script>"
                + "<p>Tariffs rose in 2024.</p>"
                + "<footer>Copyright</footer>"
                + "</body></html>";

            // When
            PageContent page = parse(html);

            // Then
            assertThat(page.isSuccess()).isTrue();
            assertThat(page.getContent()).isEqualTo("Tariffs rose in 2024.");
            assertThat(page.getContentType()).isEqualTo("text/html");
        }

        @Test
        @DisplayName("The article element is preferred over the whole body")
        void prefersArticle() {
            PageContent page = parse("<html><body><div>Sidebar teaser</div>"
                + "<article><p>Main story.</p></article></body></html>");

            assertThat(page.getContent()).isEqualTo("Main story.");
        }

        @Test
        @DisplayName("An empty page gets a marker instead of blank content")
        void emptyPage() {
            PageContent page = parse("<html><body><script>x()</script></body></html>");

            assertThat(page.getContent()).isEqualTo("[No content extracted]");
        }

        @Test
        @DisplayName("Long content is cut at the configured length")
        void truncates() {
            properties.getFetch().setMaxContentLength(10);

            PageContent page = parse("<html><body><p>abcdefghijklmnopqrstuvwxyz</p></body></html>");

            assertThat(page.getContent()).isEqualTo("abcdefghij" + JsoupPageFetcher.TRUNCATION_SUFFIX);
        }
    }

    @Nested
    @DisplayName("URLs")
    class Urls {

        @ParameterizedTest
        @ValueSource(strings = {"https://example.com", "http://example.com/a?b=c"})
        @DisplayName("HTTP and HTTPS URLs with a host are valid")
        void valid(String url) {
            assertThat(JsoupPageFetcher.isValidUrl(url)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "ftp://example.com/file", "not a url", "https://"})
        @DisplayName("Anything else is rejected")
        void invalid(String url) {
            assertThat(JsoupPageFetcher.isValidUrl(url)).isFalse();
        }

        @Test
        @DisplayName("Invalid URLs are not fetched")
        void invalidNotFetched() {
            assertThat(fetcher.fetch("mailto:someone@example.com")).isNull();
        }

        @Test
        @DisplayName("Last path segment ignores a trailing slash")
        void lastSegment() {
            assertThat(JsoupPageFetcher.lastPathSegment("https://example.com/docs/guide/")).isEqualTo("guide");
            assertThat(JsoupPageFetcher.lastPathSegment("https://example.com/docs")).isEqualTo("docs");
        }
    }
}
