package fun.fengwk.msh.core.service.scrape.model;

/**
 * Closed classification of why a scrape failed.
 *
 * @author fengwk
 */
public enum ErrorKind {

    /**
     * Bad input, never retried.
     */
    VALIDATION("ValidationError", "VALIDATION_ERROR", false),

    /**
     * Transient network failure, the single url may be retried.
     */
    NETWORK("NetworkError", "NETWORK_ERROR", true),

    /**
     * Render exceeded its wait budget, retry with a larger wait time.
     */
    TIMEOUT("TimeoutError", "TIMEOUT_ERROR", true),

    /**
     * Renderer internal failure.
     */
    BROWSER("BrowserError", "BROWSER_ERROR", true),

    /**
     * Normalization failed on already fetched html, fetching again will not help.
     */
    CONTENT_PROCESSING("ContentProcessingError", "CONTENT_PROCESSING_ERROR", false);

    private final String tag;
    private final String code;
    private final boolean retryable;

    ErrorKind(String tag, String code, boolean retryable) {
        this.tag = tag;
        this.code = code;
        this.retryable = retryable;
    }

    public String getTag() {
        return tag;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }

}
