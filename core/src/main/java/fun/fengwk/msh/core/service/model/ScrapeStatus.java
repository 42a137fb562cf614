package fun.fengwk.msh.core.service.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Scraper capabilities and limits.
 *
 * @author fengwk
 */
@Data
@Builder
public class ScrapeStatus {

    private String service;

    private String status;

    private String timestamp;

    private boolean singleScrape;

    private boolean batchScrape;

    private boolean metadataExtraction;

    private boolean customSelectors;

    private List<String> supportedFormats;

    private int maxConcurrentRequests;

    private int maxWaitTime;

    private int requestTimeout;

    private int maxBatchSize;

    private int maxUrlLength;

    private long maxContentLength;

}
