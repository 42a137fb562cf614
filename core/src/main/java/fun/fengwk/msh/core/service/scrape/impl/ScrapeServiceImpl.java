package fun.fengwk.msh.core.service.scrape.impl;

import fun.fengwk.msh.core.service.browser.PageRenderer;
import fun.fengwk.msh.core.service.browser.RenderFailureClassifier;
import fun.fengwk.msh.core.service.browser.RenderRequest;
import fun.fengwk.msh.core.service.browser.RenderedPage;
import fun.fengwk.msh.core.service.scrape.ScrapeException;
import fun.fengwk.msh.core.service.scrape.ScrapeProperties;
import fun.fengwk.msh.core.service.scrape.ScrapeService;
import fun.fengwk.msh.core.service.scrape.content.ContentProcessor;
import fun.fengwk.msh.core.service.scrape.content.ProcessedContent;
import fun.fengwk.msh.core.service.scrape.model.BatchResult;
import fun.fengwk.msh.core.service.scrape.model.ScrapeOptions;
import fun.fengwk.msh.core.service.scrape.model.ScrapeResult;
import fun.fengwk.msh.core.service.scrape.parser.MetadataExtractor;
import fun.fengwk.msh.core.service.scrape.validation.CssSelectorValidator;
import fun.fengwk.msh.core.service.scrape.validation.UrlValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scrape service implementation.
 *
 * <p>A single scrape moves through {@code PENDING -> VALIDATING -> RENDERING -> NORMALIZING -> DONE};
 * a failure in any state ends the scrape with a failed result.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScrapeServiceImpl implements ScrapeService {

    private final ScrapeProperties scrapeProperties;
    private final UrlValidator urlValidator;
    private final CssSelectorValidator cssSelectorValidator;
    private final PageRenderer pageRenderer;
    private final ContentProcessor contentProcessor;
    private final MetadataExtractor metadataExtractor;

    @Override
    public ScrapeResult scrapeSingle(String url, ScrapeOptions options) {
        long startNanos = System.nanoTime();
        ScrapeOptions effective = options == null ? ScrapeOptions.defaults() : options;
        ScrapeState state = ScrapeState.PENDING;
        try {
            state = transition(url, state, ScrapeState.VALIDATING);
            effective.validate();
            if (!urlValidator.isValid(url)) {
                throw ScrapeException.validation("Invalid or unsafe URL: " + url, "url", url);
            }
            Set<String> removeSelectors = resolveRemoveSelectors(effective);

            state = transition(url, state, ScrapeState.RENDERING);
            RenderedPage page = render(url, effective);

            state = transition(url, state, ScrapeState.NORMALIZING);
            String title = effective.isIncludeTitle() ? page.title() : null;
            ProcessedContent processed = contentProcessor.process(
                page.html(), title, effective.getOutputFormat(), removeSelectors);
            Map<String, String> metadata = effective.isExtractMetadata()
                ? metadataExtractor.extract(page.html())
                : null;

            ScrapeResult result = ScrapeResult.success(
                url, title, processed.content(), processed.html(), metadata, elapsedSeconds(startNanos));
            transition(url, state, ScrapeState.DONE);
            log.info("scrape succeeded, url={}, length={}, costSeconds={}",
                url, result.getLength(), result.getProcessingTime());
            return result;
        } catch (ScrapeException ex) {
            return fail(url, state, ex.withUrl(url), startNanos);
        } catch (RuntimeException | StackOverflowError ex) {
            log.error("scrape failed unexpectedly, url={}, state={}", url, state, ex);
            ScrapeException wrapped = ScrapeException.browser(
                "Unexpected error scraping " + url + ": " + ex.getMessage(), url, String.valueOf(ex.getMessage()));
            return fail(url, state, wrapped, startNanos);
        }
    }

    @Override
    public BatchResult scrapeBatch(List<String> urls, ScrapeOptions options) {
        long startNanos = System.nanoTime();
        ScrapeOptions effective = options == null ? ScrapeOptions.defaults() : options;
        List<String> targets = urls == null ? List.of() : urls;
        int poolSize = resolvePoolSize(effective, targets.size());
        log.info("batch scrape started, urls={}, poolSize={}, delaySeconds={}",
            targets.size(), poolSize, effective.getDelayBetweenRequests());

        BatchScrapeExecutor executor = new BatchScrapeExecutor(
            poolSize, effective.getDelayBetweenRequests(), scrapeProperties.getWorkerThreadPrefix());
        List<ScrapeResult> results = executor.execute(targets, url -> scrapeSingle(url, effective));

        BatchResult batchResult = BatchResult.of(results, elapsedSeconds(startNanos));
        log.info("batch scrape completed, successful={}/{}, costSeconds={}",
            batchResult.getSuccessfulCount(), batchResult.getTotalUrls(), batchResult.getProcessingTime());
        return batchResult;
    }

    int resolvePoolSize(ScrapeOptions options, int urlCount) {
        int poolSize = Math.min(options.getMaxConcurrent(), urlCount);
        poolSize = Math.min(poolSize, scrapeProperties.getMaxConcurrentRequests());
        return Math.max(poolSize, 1);
    }

    private RenderedPage render(String url, ScrapeOptions options) {
        int waitTime = Math.min(options.getWaitTime(), scrapeProperties.getMaxWaitTime());
        RenderRequest request = RenderRequest.builder()
            .url(url)
            .headless(options.isHeadless())
            .waitTimeSeconds(waitTime)
            .includeTitle(options.isIncludeTitle())
            .build();
        RenderedPage page;
        try {
            page = pageRenderer.render(request);
        } catch (ScrapeException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw RenderFailureClassifier.toScrapeException(ex, url, waitTime);
        }
        if (page == null || page.html() == null) {
            throw ScrapeException.browser("Browser error for " + url + ": no content rendered", url, "no content rendered");
        }
        return page;
    }

    private Set<String> resolveRemoveSelectors(ScrapeOptions options) {
        Set<String> selectors = new LinkedHashSet<>();
        if (scrapeProperties.isApplyDefaultRemoveElements() && scrapeProperties.getDefaultRemoveElements() != null) {
            selectors.addAll(scrapeProperties.getDefaultRemoveElements());
        }
        selectors.addAll(cssSelectorValidator.validateAll(options.getRemoveElements()));
        return selectors;
    }

    private ScrapeResult fail(String url, ScrapeState state, ScrapeException failure, long startNanos) {
        log.warn("scrape failed, url={}, state={}, kind={}, error={}",
            url, state, failure.getKind(), failure.getMessage());
        transition(url, state, ScrapeState.DONE);
        return ScrapeResult.failure(url, failure, elapsedSeconds(startNanos));
    }

    private ScrapeState transition(String url, ScrapeState from, ScrapeState to) {
        log.debug("scrape state changed, url={}, from={}, to={}", url, from, to);
        return to;
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000D;
    }

    enum ScrapeState {

        PENDING,
        VALIDATING,
        RENDERING,
        NORMALIZING,
        DONE

    }

}
