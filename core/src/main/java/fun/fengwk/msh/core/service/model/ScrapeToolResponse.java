package fun.fengwk.msh.core.service.model;

import fun.fengwk.msh.core.service.scrape.model.BatchResult;
import fun.fengwk.msh.core.service.scrape.model.ScrapeResult;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Scrape tool call outcome.
 *
 * @author fengwk
 */
@Data
@Builder
public class ScrapeToolResponse {

    /**
     * HTTP style status code: 200 ok, 207 partial, 400 invalid request, 422 scrape failed, 500 internal error.
     */
    private int statusCode;

    /**
     * Single url outcome, null for batch calls and rejected requests.
     */
    private ScrapeResult result;

    /**
     * Batch outcome, null for single calls and rejected requests.
     */
    private BatchResult batch;

    /**
     * Error message when the request was rejected or failed before scraping.
     */
    private String error;

    private String errorType;

    private String errorCode;

    private Map<String, Object> errorDetails;

}
