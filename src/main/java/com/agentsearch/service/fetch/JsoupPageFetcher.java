package com.agentsearch.service.fetch;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.PageContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsoupPageFetcher implements PageFetcher {

    private static final String NOISE =
        "nav, footer, header, aside, script, style, noscript, iframe, svg, button, form";
    private static final String MAIN_CONTENT =
        "article, main, #content, .content, .article, .post";
    static final String TRUNCATION_SUFFIX = "... [Content truncated]";

    private final AgentSearchProperties properties;

    @Override
    public PageContent fetch(String url) {
        if (!isValidUrl(url)) {
            log.warn("Invalid URL format: {}", url);
            return null;
        }

        AgentSearchProperties.Fetch fetch = properties.getFetch();

        try {
            log.info("Fetching content from URL: {}", url);

            Connection.Response response = Jsoup.connect(url)
                .userAgent(fetch.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml")
                .header("Accept-Language", "en-US,en;q=0.9")
                .timeout(properties.getFetchTimeoutSeconds() * 1000)
                .ignoreContentType(true)
                .followRedirects(true)
                .execute();

            String contentType = response.contentType() != null
                ? response.contentType().toLowerCase(Locale.ROOT)
                : "";

            if (!contentType.contains("text/html")) {
                log.info("URL is not HTML (Content-Type: {}): {}", contentType, url);
                return PageContent.builder()
                    .url(url)
                    .title(lastPathSegment(url))
                    .content("[Non-HTML content: " + contentType + "]")
                    .contentType(contentType)
                    .success(false)
                    .build();
            }

            PageContent page = parse(url, response.parse(), contentType);
            pause(fetch.getRateLimitMillis());
            return page;

        } catch (IOException e) {
            log.error("Request error when fetching {}: {}", url, e.getMessage());
            return null;
        } catch (Exception e) {
            log.error("Error fetching URL {}: {}", url, e.getMessage());
            return null;
        }
    }

    /**
     * Extracts title and main text from an already-downloaded document
     */
    PageContent parse(String url, Document doc, String contentType) {
        String title = extractTitle(url, doc);

        doc.select(NOISE).remove();

        Element main = doc.selectFirst(MAIN_CONTENT);
        if (main == null) {
            main = doc.body();
        }

        String text = main != null ? main.text().trim() : "";
        if (text.isEmpty()) {
            text = "[No content extracted]";
        }

        int max = properties.getFetch().getMaxContentLength();
        if (text.length() > max) {
            text = text.substring(0, max) + TRUNCATION_SUFFIX;
        }

        return PageContent.builder()
            .url(url)
            .title(title)
            .content(text)
            .contentType(contentType)
            .success(true)
            .build();
    }

    private String extractTitle(String url, Document doc) {
        String title = doc.title();
        if (title != null && !title.isBlank()) {
            return title.trim();
        }
        Element h1 = doc.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) {
            return h1.text().trim();
        }
        return lastPathSegment(url);
    }

    static boolean isValidUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            return uri.getHost() != null
                && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    static String lastPathSegment(String url) {
        String trimmed = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        String segment = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        return segment.isBlank() ? url : segment;
    }

    private void pause(Long millis) {
        if (millis == null || millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
