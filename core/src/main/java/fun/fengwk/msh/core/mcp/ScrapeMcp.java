package fun.fengwk.msh.core.mcp;

import fun.fengwk.msh.core.service.ScrapeMcpService;
import fun.fengwk.msh.core.service.model.ScrapeStatus;
import fun.fengwk.msh.core.service.model.ScrapeToolResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ScrapeMcp {

    static final String SCRAPE_TEMPLATE = "msh_scrape_result.ftl";
    static final String BATCH_SCRAPE_TEMPLATE = "msh_batch_scrape_result.ftl";
    static final String STATUS_TEMPLATE = "msh_scrape_status.ftl";

    private final ScrapeMcpService scrapeMcpService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "scrape",
        description = """
            Render a web page in a headless browser and return its content as clean markdown and/or html.
            Only public http/https pages are accepted, local and private network hosts are rejected.
            Return format: status code, title, length, word count and processing time followed by the content; \
            or an error with its type, code and details.""",
        resultConverter = TextToolCallResultConverter.class)
    public String scrape(
        @ToolParam(description = "page url, http or https") String url,
        @ToolParam(description = "seconds to wait for the page to load, 1-30, default 5", required = false) Integer waitTime,
        @ToolParam(description = "run the browser headless, default true", required = false) Boolean headless,
        @ToolParam(description = "prepend the page title as a heading, default true", required = false) Boolean includeTitle,
        @ToolParam(description = "css selectors of elements to remove before conversion, at most 50", required = false)
        List<String> removeElements,
        @ToolParam(description = "extract description, keywords, author, date, canonical url and language, default false",
            required = false) Boolean extractMetadata,
        @ToolParam(description = "output format: markdown/html/both, default markdown", required = false) String outputFormat
    ) {
        ScrapeToolResponse response = scrapeMcpService.scrape(
            url, waitTime, headless, includeTitle, removeElements, extractMetadata, outputFormat);
        return mcpFormatter.format(SCRAPE_TEMPLATE, response);
    }

    @Tool(name = "batch_scrape",
        description = """
            Scrape several web pages concurrently and return every page result with aggregate statistics.
            Invalid urls are skipped, duplicates reject the whole request, at most 50 urls per call.
            Results are not in input order, match them by url.
            Return format: batch summary line followed by one section per url; or an error message.""",
        resultConverter = TextToolCallResultConverter.class)
    public String batchScrape(
        @ToolParam(description = "page urls, http or https, at most 50, no duplicates") List<String> urls,
        @ToolParam(description = "seconds to wait for each page to load, 1-30, default 5", required = false) Integer waitTime,
        @ToolParam(description = "run the browser headless, default true", required = false) Boolean headless,
        @ToolParam(description = "prepend the page title as a heading, default true", required = false) Boolean includeTitle,
        @ToolParam(description = "css selectors of elements to remove before conversion, at most 50", required = false)
        List<String> removeElements,
        @ToolParam(description = "output format: markdown/html/both, default markdown", required = false) String outputFormat,
        @ToolParam(description = "max pages scraped at the same time, 1-10, default 3", required = false) Integer maxConcurrent,
        @ToolParam(description = "seconds each worker pauses between pages, 0.1-10, default 1", required = false)
        Double delayBetweenRequests
    ) {
        ScrapeToolResponse response = scrapeMcpService.batchScrape(
            urls, waitTime, headless, includeTitle, removeElements, outputFormat, maxConcurrent, delayBetweenRequests);
        return mcpFormatter.format(BATCH_SCRAPE_TEMPLATE, response);
    }

    @Tool(name = "scrape_status",
        description = """
            Report scraper capabilities and limits.
            No parameters.""",
        resultConverter = TextToolCallResultConverter.class)
    public String scrapeStatus() {
        ScrapeStatus status = scrapeMcpService.status();
        return mcpFormatter.format(STATUS_TEMPLATE, status);
    }

}
