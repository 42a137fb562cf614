package fun.fengwk.msh.core.service.scrape.model;

import fun.fengwk.msh.core.service.scrape.ScrapeException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Per-request scrape options, read-only for the lifetime of the request.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class ScrapeOptions {

    public static final int MIN_WAIT_TIME = 1;
    public static final int MAX_WAIT_TIME = 30;
    public static final int MIN_CONCURRENT = 1;
    public static final int MAX_CONCURRENT = 10;
    public static final double MIN_DELAY_SECONDS = 0.1D;
    public static final double MAX_DELAY_SECONDS = 10.0D;

    /**
     * Render wait budget in seconds.
     */
    @Builder.Default
    int waitTime = 5;

    @Builder.Default
    boolean headless = true;

    @Builder.Default
    boolean includeTitle = true;

    /**
     * CSS selectors of elements removed before conversion.
     */
    @Singular("removeElement")
    Set<String> removeElements;

    @Builder.Default
    boolean extractMetadata = false;

    @Builder.Default
    OutputFormat outputFormat = OutputFormat.MARKDOWN;

    /**
     * Batch only, upper bound of scrapes in flight.
     */
    @Builder.Default
    int maxConcurrent = 3;

    /**
     * Batch only, pause in seconds a worker takes after each completed scrape.
     */
    @Builder.Default
    double delayBetweenRequests = 1.0D;

    public static ScrapeOptions defaults() {
        return ScrapeOptions.builder().build();
    }

    /**
     * Checks every bounded field.
     *
     * @throws ScrapeException of kind {@link ErrorKind#VALIDATION} naming the first offending field
     */
    public void validate() {
        if (waitTime < MIN_WAIT_TIME || waitTime > MAX_WAIT_TIME) {
            throw ScrapeException.validation(
                "wait_time must be between " + MIN_WAIT_TIME + " and " + MAX_WAIT_TIME, "wait_time", waitTime);
        }
        if (outputFormat == null) {
            throw ScrapeException.validation("output_format is required", "output_format", null);
        }
        if (maxConcurrent < MIN_CONCURRENT || maxConcurrent > MAX_CONCURRENT) {
            throw ScrapeException.validation(
                "max_concurrent must be between " + MIN_CONCURRENT + " and " + MAX_CONCURRENT,
                "max_concurrent",
                maxConcurrent
            );
        }
        if (Double.isNaN(delayBetweenRequests)
            || delayBetweenRequests < MIN_DELAY_SECONDS
            || delayBetweenRequests > MAX_DELAY_SECONDS) {
            throw ScrapeException.validation(
                "delay_between_requests must be between " + MIN_DELAY_SECONDS + " and " + MAX_DELAY_SECONDS,
                "delay_between_requests",
                delayBetweenRequests
            );
        }
    }

}
