package fun.fengwk.msh.core.service.scrape.model;

import fun.fengwk.msh.core.service.scrape.ScrapeException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ScrapeResultTest {

    @Test
    public void shouldMeasureMarkdownContent() {
        ScrapeResult result = ScrapeResult.success(
            "https://a.com", "Title", "# Title\n\nhello world", "<p>hello world</p>", Map.of("author", "x"), 1.5D);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLength()).isEqualTo(20);
        assertThat(result.getWordCount()).isEqualTo(4);
        assertThat(result.getError()).isNull();
        assertThat(result.getErrorKind()).isNull();
        assertThat(result.getMetadata()).containsEntry("author", "x");
        assertThat(result.getTimestamp()).isNotBlank();
    }

    @Test
    public void shouldMeasureHtmlWhenNoMarkdown() {
        ScrapeResult result = ScrapeResult.success("https://a.com", " ", null, "<p>a b</p>", null, 0.2D);

        assertThat(result.getLength()).isEqualTo(10);
        assertThat(result.getWordCount()).isEqualTo(2);
        assertThat(result.getTitle()).isNull();
    }

    @Test
    public void shouldRequireSomeContentForSuccess() {
        assertThatThrownBy(() -> ScrapeResult.success("https://a.com", null, null, null, null, 0D))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldNeverCarryContentOnFailure() {
        ScrapeException failure = ScrapeException.timeout("Page load timeout for https://a.com", "https://a.com", 5);

        ScrapeResult result = ScrapeResult.failure("https://a.com", failure, 5.1D);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getContent()).isNull();
        assertThat(result.getHtml()).isNull();
        assertThat(result.getLength()).isNull();
        assertThat(result.getWordCount()).isNull();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(result.getErrorCode()).isEqualTo("TIMEOUT_ERROR");
        assertThat(result.getErrorDetails()).containsEntry("timeout_seconds", 5).containsEntry("url", "https://a.com");
        assertThat(result.getProcessingTime()).isEqualTo(5.1D);
    }

    @Test
    public void shouldExposeReadOnlyErrorDetails() {
        ScrapeResult result = ScrapeResult.failure(
            "https://a.com", ScrapeException.network("down", "https://a.com"), 0.1D);

        assertThatThrownBy(() -> result.getErrorDetails().put("url", "https://b.com"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(result.getErrorDetails()).containsEntry("url", "https://a.com");
    }

}
