package fun.fengwk.msh.core.service.scrape.model;

import fun.fengwk.msh.core.service.scrape.ScrapeException;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one url scrape attempt.
 *
 * <p>Only built through {@link #success} and {@link #failure}: a successful result never carries
 * error fields, a failed one never carries content, html, length or word count.
 *
 * @author fengwk
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class ScrapeResult {

    boolean success;
    String url;
    String title;
    String content;
    String html;
    Map<String, String> metadata;
    Integer length;
    Integer wordCount;

    /**
     * Wall clock seconds spent on this url only.
     */
    Double processingTime;

    String error;
    ErrorKind errorKind;
    String errorCode;
    Map<String, Object> errorDetails;
    String timestamp;

    public static ScrapeResult success(
        String url,
        String title,
        String content,
        String html,
        Map<String, String> metadata,
        double processingTime
    ) {
        if (content == null && html == null) {
            throw new IllegalArgumentException("successful result requires content or html");
        }
        String measured = content != null ? content : html;
        return ScrapeResult.builder()
            .success(true)
            .url(url)
            .title(StringUtils.isBlank(title) ? null : title)
            .content(content)
            .html(html)
            .metadata(metadata == null ? null : Map.copyOf(metadata))
            .length(measured.length())
            .wordCount(countWords(measured))
            .processingTime(processingTime)
            .timestamp(Instant.now().toString())
            .build();
    }

    public static ScrapeResult failure(String url, ScrapeException failure, Double processingTime) {
        Map<String, Object> details = Collections.unmodifiableMap(new LinkedHashMap<>(failure.getDetails()));
        return ScrapeResult.builder()
            .success(false)
            .url(url)
            .error(failure.getMessage())
            .errorKind(failure.getKind())
            .errorCode(failure.getKind().getCode())
            .errorDetails(details)
            .processingTime(processingTime)
            .timestamp(Instant.now().toString())
            .build();
    }

    static int countWords(String text) {
        return StringUtils.split(text).length;
    }

}
