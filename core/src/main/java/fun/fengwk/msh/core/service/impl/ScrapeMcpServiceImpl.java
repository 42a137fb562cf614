package fun.fengwk.msh.core.service.impl;

import fun.fengwk.msh.core.service.ScrapeMcpService;
import fun.fengwk.msh.core.service.model.ScrapeStatus;
import fun.fengwk.msh.core.service.model.ScrapeToolResponse;
import fun.fengwk.msh.core.service.scrape.ContentProcessingProperties;
import fun.fengwk.msh.core.service.scrape.ScrapeException;
import fun.fengwk.msh.core.service.scrape.ScrapeProperties;
import fun.fengwk.msh.core.service.scrape.ScrapeService;
import fun.fengwk.msh.core.service.scrape.model.BatchResult;
import fun.fengwk.msh.core.service.scrape.model.ErrorKind;
import fun.fengwk.msh.core.service.scrape.model.OutputFormat;
import fun.fengwk.msh.core.service.scrape.model.ScrapeOptions;
import fun.fengwk.msh.core.service.scrape.model.ScrapeResult;
import fun.fengwk.msh.core.service.scrape.validation.CssSelectorValidator;
import fun.fengwk.msh.core.service.scrape.validation.UrlValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScrapeMcpServiceImpl implements ScrapeMcpService {

    static final int STATUS_OK = 200;
    static final int STATUS_MULTI_STATUS = 207;
    static final int STATUS_BAD_REQUEST = 400;
    static final int STATUS_UNPROCESSABLE = 422;
    static final int STATUS_INTERNAL_ERROR = 500;

    private final ScrapeService scrapeService;
    private final UrlValidator urlValidator;
    private final CssSelectorValidator cssSelectorValidator;
    private final ScrapeProperties scrapeProperties;
    private final ContentProcessingProperties contentProcessingProperties;

    @Override
    public ScrapeToolResponse scrape(
        String url,
        Integer waitTime,
        Boolean headless,
        Boolean includeTitle,
        List<String> removeElements,
        Boolean extractMetadata,
        String outputFormat
    ) {
        try {
            ScrapeOptions options = buildOptions(
                waitTime, headless, includeTitle, removeElements, extractMetadata, outputFormat, null, null);
            urlValidator.validateStrict(url);

            ScrapeResult result = scrapeService.scrapeSingle(url, options);
            int statusCode = result.isSuccess() ? STATUS_OK : STATUS_UNPROCESSABLE;
            log.info("scrape request completed, url={}, statusCode={}", url, statusCode);
            return ScrapeToolResponse.builder()
                .statusCode(statusCode)
                .result(result)
                .build();
        } catch (ScrapeException ex) {
            return errorResponse(ex);
        } catch (IllegalArgumentException ex) {
            log.warn("invalid scrape request, url={}, error={}", url, ex.getMessage());
            return badRequest(ex);
        } catch (RuntimeException ex) {
            log.error("unexpected error in scrape request, url={}", url, ex);
            return internalError(ex);
        }
    }

    @Override
    public ScrapeToolResponse batchScrape(
        List<String> urls,
        Integer waitTime,
        Boolean headless,
        Boolean includeTitle,
        List<String> removeElements,
        String outputFormat,
        Integer maxConcurrent,
        Double delayBetweenRequests
    ) {
        try {
            ScrapeOptions options = buildOptions(
                waitTime, headless, includeTitle, removeElements, false, outputFormat, maxConcurrent, delayBetweenRequests);
            int maxBatchUrls = Math.min(scrapeProperties.getMaxBatchUrls(), scrapeProperties.getMaxBatchSize());
            if (urls != null && urls.size() > maxBatchUrls) {
                throw ScrapeException.validation(
                    "Too many URLs in batch (max " + maxBatchUrls + ")", "urls", urls.size());
            }
            List<String> validUrls = urlValidator.validateBatch(urls);

            BatchResult batch = scrapeService.scrapeBatch(validUrls, options);
            int statusCode = batchStatusCode(batch);
            log.info("batch scrape request completed, urls={}, successful={}, statusCode={}",
                batch.getTotalUrls(), batch.getSuccessfulCount(), statusCode);
            return ScrapeToolResponse.builder()
                .statusCode(statusCode)
                .batch(batch)
                .build();
        } catch (ScrapeException ex) {
            return errorResponse(ex);
        } catch (IllegalArgumentException ex) {
            log.warn("invalid batch scrape request, error={}", ex.getMessage());
            return badRequest(ex);
        } catch (RuntimeException ex) {
            log.error("unexpected error in batch scrape request", ex);
            return internalError(ex);
        }
    }

    @Override
    public ScrapeStatus status() {
        return ScrapeStatus.builder()
            .service("web_scraper")
            .status("operational")
            .timestamp(Instant.now().toString())
            .singleScrape(true)
            .batchScrape(true)
            .metadataExtraction(true)
            .customSelectors(true)
            .supportedFormats(Arrays.stream(OutputFormat.values()).map(OutputFormat::getValue).toList())
            .maxConcurrentRequests(scrapeProperties.getMaxConcurrentRequests())
            .maxWaitTime(scrapeProperties.getMaxWaitTime())
            .requestTimeout(scrapeProperties.getRequestTimeout())
            .maxBatchSize(Math.min(scrapeProperties.getMaxBatchUrls(), scrapeProperties.getMaxBatchSize()))
            .maxUrlLength(UrlValidator.MAX_URL_LENGTH)
            .maxContentLength(contentProcessingProperties.getMaxContentLength())
            .build();
    }

    static int batchStatusCode(BatchResult batch) {
        if (batch.getFailedCount() == 0) {
            return STATUS_OK;
        }
        if (batch.getSuccessfulCount() > 0) {
            return STATUS_MULTI_STATUS;
        }
        return STATUS_UNPROCESSABLE;
    }

    private ScrapeOptions buildOptions(
        Integer waitTime,
        Boolean headless,
        Boolean includeTitle,
        List<String> removeElements,
        Boolean extractMetadata,
        String outputFormat,
        Integer maxConcurrent,
        Double delayBetweenRequests
    ) {
        ScrapeOptions.ScrapeOptionsBuilder builder = ScrapeOptions.builder()
            .waitTime(waitTime == null ? scrapeProperties.getDefaultWaitTime() : waitTime)
            .outputFormat(OutputFormat.fromValue(outputFormat))
            .removeElements(cssSelectorValidator.validateAll(removeElements));
        if (headless != null) {
            builder.headless(headless);
        }
        if (includeTitle != null) {
            builder.includeTitle(includeTitle);
        }
        if (extractMetadata != null) {
            builder.extractMetadata(extractMetadata);
        }
        if (maxConcurrent != null) {
            builder.maxConcurrent(maxConcurrent);
        }
        if (delayBetweenRequests != null) {
            builder.delayBetweenRequests(delayBetweenRequests);
        }
        ScrapeOptions options = builder.build();
        options.validate();
        return options;
    }

    private ScrapeToolResponse errorResponse(ScrapeException ex) {
        int statusCode = ex.getKind() == ErrorKind.VALIDATION ? STATUS_BAD_REQUEST : STATUS_UNPROCESSABLE;
        log.warn("scrape request rejected, kind={}, error={}", ex.getKind(), ex.getMessage());
        return ScrapeToolResponse.builder()
            .statusCode(statusCode)
            .error(ex.getMessage())
            .errorType(ex.getKind().getTag())
            .errorCode(ex.getKind().getCode())
            .errorDetails(ex.getDetails())
            .build();
    }

    private ScrapeToolResponse badRequest(IllegalArgumentException ex) {
        return ScrapeToolResponse.builder()
            .statusCode(STATUS_BAD_REQUEST)
            .error("Invalid request data: " + ex.getMessage())
            .errorType(ErrorKind.VALIDATION.getTag())
            .errorCode("INVALID_REQUEST")
            .errorDetails(Map.of())
            .build();
    }

    private ScrapeToolResponse internalError(RuntimeException ex) {
        return ScrapeToolResponse.builder()
            .statusCode(STATUS_INTERNAL_ERROR)
            .error("Internal server error occurred during scraping")
            .errorType("InternalError")
            .errorCode("INTERNAL_ERROR")
            .errorDetails(Map.of("original_error", String.valueOf(ex.getMessage())))
            .build();
    }

}
