package fun.fengwk.msh.core.service.impl;

import fun.fengwk.msh.core.service.model.ScrapeStatus;
import fun.fengwk.msh.core.service.model.ScrapeToolResponse;
import fun.fengwk.msh.core.service.scrape.ContentProcessingProperties;
import fun.fengwk.msh.core.service.scrape.ScrapeException;
import fun.fengwk.msh.core.service.scrape.ScrapeProperties;
import fun.fengwk.msh.core.service.scrape.ScrapeService;
import fun.fengwk.msh.core.service.scrape.model.BatchResult;
import fun.fengwk.msh.core.service.scrape.model.OutputFormat;
import fun.fengwk.msh.core.service.scrape.model.ScrapeOptions;
import fun.fengwk.msh.core.service.scrape.model.ScrapeResult;
import fun.fengwk.msh.core.service.scrape.validation.CssSelectorValidator;
import fun.fengwk.msh.core.service.scrape.validation.UrlValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class ScrapeMcpServiceImplTest {

    @Mock
    private ScrapeService scrapeService;

    private ScrapeProperties scrapeProperties;

    private ScrapeMcpServiceImpl scrapeMcpService;

    @BeforeEach
    void setUp() {
        scrapeProperties = new ScrapeProperties();
        scrapeMcpService = new ScrapeMcpServiceImpl(
            scrapeService,
            new UrlValidator(scrapeProperties),
            new CssSelectorValidator(),
            scrapeProperties,
            new ContentProcessingProperties()
        );
    }

    @Test
    public void shouldReturnOkForSuccessfulScrape() {
        ScrapeResult result = ScrapeResult.success("https://example.com", "T", "# T", null, null, 0.5D);
        when(scrapeService.scrapeSingle(eq("https://example.com"), any())).thenReturn(result);

        ScrapeToolResponse response = scrapeMcpService.scrape(
            "https://example.com", 10, false, null, List.of(".ads", "<script>"), true, "both");

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getResult()).isSameAs(result);
        ArgumentCaptor<ScrapeOptions> captor = ArgumentCaptor.forClass(ScrapeOptions.class);
        verify(scrapeService).scrapeSingle(eq("https://example.com"), captor.capture());
        ScrapeOptions options = captor.getValue();
        assertThat(options.getWaitTime()).isEqualTo(10);
        assertThat(options.isHeadless()).isFalse();
        assertThat(options.isIncludeTitle()).isTrue();
        assertThat(options.isExtractMetadata()).isTrue();
        assertThat(options.getOutputFormat()).isEqualTo(OutputFormat.BOTH);
        assertThat(options.getRemoveElements()).containsExactly(".ads");
    }

    @Test
    public void shouldReturnUnprocessableForFailedScrape() {
        ScrapeResult result = ScrapeResult.failure(
            "https://example.com", ScrapeException.network("Network error accessing https://example.com: down",
                "https://example.com"), 0.5D);
        when(scrapeService.scrapeSingle(eq("https://example.com"), any())).thenReturn(result);

        ScrapeToolResponse response = scrapeMcpService.scrape("https://example.com", null, null, null, null, null, null);

        assertThat(response.getStatusCode()).isEqualTo(422);
        assertThat(response.getResult().getErrorCode()).isEqualTo("NETWORK_ERROR");
    }

    @Test
    public void shouldRejectInvalidUrl() {
        ScrapeToolResponse response = scrapeMcpService.scrape("not a url", null, null, null, null, null, null);

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getErrorCode()).isEqualTo("VALIDATION_ERROR");
        assertThat(response.getErrorType()).isEqualTo("ValidationError");
        assertThat(response.getErrorDetails()).containsEntry("field", "url");
        verify(scrapeService, never()).scrapeSingle(anyString(), any());
    }

    @Test
    public void shouldRejectOutOfRangeWaitTime() {
        ScrapeToolResponse response = scrapeMcpService.scrape("https://example.com", 31, null, null, null, null, null);

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getErrorDetails()).containsEntry("field", "wait_time");
    }

    @Test
    public void shouldRejectUnsupportedOutputFormat() {
        ScrapeToolResponse response = scrapeMcpService.scrape("https://example.com", null, null, null, null, null, "pdf");

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getErrorCode()).isEqualTo("INVALID_REQUEST");
        assertThat(response.getError()).isEqualTo("Invalid request data: unsupported output_format: pdf");
    }

    @Test
    public void shouldReturnInternalErrorForUnexpectedFailure() {
        when(scrapeService.scrapeSingle(anyString(), any())).thenThrow(new IllegalStateException("boom"));

        ScrapeToolResponse response = scrapeMcpService.scrape("https://example.com", null, null, null, null, null, null);

        assertThat(response.getStatusCode()).isEqualTo(500);
        assertThat(response.getErrorCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(response.getErrorDetails()).containsEntry("original_error", "boom");
    }

    @Test
    public void shouldMapBatchStatusCodes() {
        ScrapeResult ok = ScrapeResult.success("https://a.com", null, "a", null, null, 0.1D);
        ScrapeResult failed = ScrapeResult.failure("https://b.com", ScrapeException.browser("crash", "https://b.com", "crash"), 0.1D);

        assertThat(ScrapeMcpServiceImpl.batchStatusCode(BatchResult.of(List.of(ok), 0.1D))).isEqualTo(200);
        assertThat(ScrapeMcpServiceImpl.batchStatusCode(BatchResult.of(List.of(ok, failed), 0.1D))).isEqualTo(207);
        assertThat(ScrapeMcpServiceImpl.batchStatusCode(BatchResult.of(List.of(failed), 0.1D))).isEqualTo(422);
    }

    @Test
    public void shouldScrapeOnlyValidBatchUrls() {
        BatchResult batch = BatchResult.of(List.of(
            ScrapeResult.success("https://a.com", null, "a", null, null, 0.1D)), 0.2D);
        when(scrapeService.scrapeBatch(anyList(), any())).thenReturn(batch);

        ScrapeToolResponse response = scrapeMcpService.batchScrape(
            List.of("https://a.com", "http://localhost"), null, null, null, null, null, 4, 0.2D);

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getBatch()).isSameAs(batch);
        ArgumentCaptor<ScrapeOptions> captor = ArgumentCaptor.forClass(ScrapeOptions.class);
        verify(scrapeService).scrapeBatch(eq(List.of("https://a.com")), captor.capture());
        assertThat(captor.getValue().getMaxConcurrent()).isEqualTo(4);
        assertThat(captor.getValue().getDelayBetweenRequests()).isEqualTo(0.2D);
        assertThat(captor.getValue().isExtractMetadata()).isFalse();
    }

    @Test
    public void shouldRejectOversizedBatch() {
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 51; i++) {
            urls.add("https://example.com/" + i);
        }

        ScrapeToolResponse response = scrapeMcpService.batchScrape(urls, null, null, null, null, null, null, null);

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getError()).isEqualTo("Too many URLs in batch (max 50)");
        verify(scrapeService, never()).scrapeBatch(anyList(), any());
    }

    @Test
    public void shouldRejectBatchWithoutValidUrls() {
        ScrapeToolResponse response = scrapeMcpService.batchScrape(
            List.of("ftp://a.com", "http://localhost"), null, null, null, null, null, null, null);

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getError()).isEqualTo("No valid URLs found in batch");
        assertThat(response.getErrorDetails()).containsEntry("invalid_count", 2);
    }

    @Test
    public void shouldRejectOutOfRangeConcurrency() {
        ScrapeToolResponse response = scrapeMcpService.batchScrape(
            List.of("https://a.com"), null, null, null, null, null, 11, null);

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getErrorDetails()).containsEntry("field", "max_concurrent");
    }

    @Test
    public void shouldReportStatus() {
        ScrapeStatus status = scrapeMcpService.status();

        assertThat(status.getStatus()).isEqualTo("operational");
        assertThat(status.getSupportedFormats()).containsExactly("markdown", "html", "both");
        assertThat(status.getMaxBatchSize()).isEqualTo(50);
        assertThat(status.getMaxUrlLength()).isEqualTo(2048);
        assertThat(status.getMaxContentLength()).isEqualTo(20_000_000L);
    }

}
