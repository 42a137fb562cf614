package fun.fengwk.msh.core.service.scrape;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scrape orchestration configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.scrape")
public class ScrapeProperties {

    /**
     * Wait time in seconds used when a request does not set one.
     */
    private int defaultWaitTime = 5;

    /**
     * Upper bound for the per url render wait time in seconds.
     */
    private int maxWaitTime = 30;

    /**
     * Process wide ceiling for concurrent scrapes in one batch.
     */
    private int maxConcurrentRequests = 10;

    /**
     * Overall request timeout in seconds advertised to callers.
     */
    private int requestTimeout = 60;

    /**
     * Max input urls accepted by batch validation.
     */
    private int maxBatchSize = 100;

    /**
     * Max urls accepted per batch tool call, the stricter cap wins at the tool boundary.
     */
    private int maxBatchUrls = 50;

    /**
     * Whether {@link #defaultRemoveElements} are stripped from every page.
     */
    private boolean applyDefaultRemoveElements = true;

    /**
     * Selectors of page chrome removed before conversion.
     */
    private List<String> defaultRemoveElements = new ArrayList<>(List.of(
        "script", "style", "noscript",
        "nav", "header", "footer",
        ".advertisement", ".ads", ".ad",
        ".social-share", ".social-sharing",
        "#comments", ".comments",
        ".sidebar", ".related-articles",
        ".newsletter-signup", ".popup",
        ".cookie-notice", ".gdpr-notice"
    ));

    /**
     * Thread name prefix for batch workers.
     */
    private String workerThreadPrefix = "msh-scrape-worker-";

}
