package fun.fengwk.msh.core.service;

import fun.fengwk.msh.core.service.model.ScrapeStatus;
import fun.fengwk.msh.core.service.model.ScrapeToolResponse;

import java.util.List;

/**
 * Scrape tool operations, raw tool arguments in and status coded responses out.
 *
 * @author fengwk
 */
public interface ScrapeMcpService {

    ScrapeToolResponse scrape(
        String url,
        Integer waitTime,
        Boolean headless,
        Boolean includeTitle,
        List<String> removeElements,
        Boolean extractMetadata,
        String outputFormat
    );

    ScrapeToolResponse batchScrape(
        List<String> urls,
        Integer waitTime,
        Boolean headless,
        Boolean includeTitle,
        List<String> removeElements,
        String outputFormat,
        Integer maxConcurrent,
        Double delayBetweenRequests
    );

    ScrapeStatus status();

}
