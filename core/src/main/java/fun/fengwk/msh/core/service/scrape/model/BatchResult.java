package fun.fengwk.msh.core.service.scrape.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate of one batch scrape.
 *
 * <p>{@code success} only states that the batch ran to completion; per url outcomes are
 * reported through the counts. Result order does not follow input order.
 *
 * @author fengwk
 */
@Value
public class BatchResult {

    boolean success;
    int totalUrls;
    int successfulCount;
    int failedCount;
    List<ScrapeResult> results;

    /**
     * Wall clock seconds for the whole batch, not the sum of per url times.
     */
    double processingTime;

    int totalWords;
    int totalContentLength;

    /**
     * Mean of per url processing times, null when no result carries one.
     */
    Double averageProcessingTime;

    String timestamp;

    public static BatchResult of(List<ScrapeResult> results, double processingTime) {
        List<ScrapeResult> copied = List.copyOf(Objects.requireNonNull(results, "results"));
        int successful = 0;
        int words = 0;
        int contentLength = 0;
        double timeSum = 0D;
        int timed = 0;
        for (ScrapeResult result : copied) {
            if (result.isSuccess()) {
                successful++;
                words += result.getWordCount() == null ? 0 : result.getWordCount();
                contentLength += result.getLength() == null ? 0 : result.getLength();
            }
            if (result.getProcessingTime() != null) {
                timeSum += result.getProcessingTime();
                timed++;
            }
        }
        return new BatchResult(
            true,
            copied.size(),
            successful,
            copied.size() - successful,
            copied,
            processingTime,
            words,
            contentLength,
            timed == 0 ? null : timeSum / timed,
            Instant.now().toString()
        );
    }

}
