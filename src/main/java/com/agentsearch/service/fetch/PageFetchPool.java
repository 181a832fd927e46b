package com.agentsearch.service.fetch;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.PageContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs page fetches through the shared bounded worker pool. The pool is
 * process-wide and stateless across requests; each call keeps its own results.
 */
@Slf4j
@Service
public class PageFetchPool {

    private final PageFetcher pageFetcher;
    private final ExecutorService executor;
    private final AgentSearchProperties properties;

    public PageFetchPool(PageFetcher pageFetcher,
                         @Qualifier("pageFetchExecutor") ExecutorService executor,
                         AgentSearchProperties properties) {
        this.pageFetcher = pageFetcher;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Fetch every URL, in parallel when enabled and there is more than one.
     * Pages that fail, time out or are not usable are dropped.
     */
    public FetchReport fetchAll(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return FetchReport.empty();
        }

        FetchReport report = properties.isParallelFetch() && urls.size() > 1
            ? fetchParallel(urls)
            : fetchSequential(urls);

        log.info("Successfully fetched {} of {} web pages", report.pages().size(), urls.size());
        return report;
    }

    private FetchReport fetchSequential(List<String> urls) {
        List<PageContent> pages = new ArrayList<>();
        List<String> dropped = new ArrayList<>();

        for (String url : urls) {
            PageContent page;
            try {
                page = pageFetcher.fetch(url);
            } catch (RuntimeException e) {
                log.error("Error processing {}: {}", url, e.getMessage());
                page = null;
            }
            collect(url, page, pages, dropped);
        }

        return new FetchReport(pages, dropped);
    }

    private FetchReport fetchParallel(List<String> urls) {
        // cancel(true) interrupts the worker thread
        List<Future<PageContent>> futures = new ArrayList<>(urls.size());
        for (String url : urls) {
            futures.add(executor.submit(() -> pageFetcher.fetch(url)));
        }

        long waitMillis = properties.getFetchTimeoutSeconds() * 2000L
            + Math.max(0L, properties.getFetch().getRateLimitMillis());

        List<PageContent> pages = new ArrayList<>();
        List<String> dropped = new ArrayList<>();

        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            Future<PageContent> future = futures.get(i);
            PageContent page = null;

            try {
                page = future.get(waitMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Fetch timed out after {}ms: {}", waitMillis, url);
                future.cancel(true);
            } catch (ExecutionException e) {
                log.error("Error processing {}: {}", url, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {}", url);
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                dropped.addAll(urls.subList(i, urls.size()));
                break;
            }
            collect(url, page, pages, dropped);
        }

        return new FetchReport(pages, dropped);
    }

    private void collect(String url, PageContent page, List<PageContent> pages, List<String> dropped) {
        if (page != null && page.isSuccess()) {
            pages.add(page);
        } else {
            log.warn("Dropping page: {}", url);
            dropped.add(url);
        }
    }
}
