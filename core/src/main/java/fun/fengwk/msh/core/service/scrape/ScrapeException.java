package fun.fengwk.msh.core.service.scrape;

import fun.fengwk.msh.core.service.scrape.model.ErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scrape failure tagged with its {@link ErrorKind}.
 *
 * <p>The kind is fixed where the failure is raised and travels with the exception, together with
 * structured details such as {@code url} or {@code timeout_seconds}.
 *
 * @author fengwk
 */
public final class ScrapeException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    public ScrapeException(ErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    public ScrapeException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.details = details == null || details.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public static ScrapeException validation(String message, String field, Object value) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (field != null) {
            details.put("field", field);
        }
        if (value != null) {
            details.put("value", String.valueOf(value));
        }
        return new ScrapeException(ErrorKind.VALIDATION, message, details);
    }

    public static ScrapeException network(String message, String url) {
        return new ScrapeException(ErrorKind.NETWORK, message, urlDetails(url));
    }

    public static ScrapeException timeout(String message, String url, Integer timeoutSeconds) {
        Map<String, Object> details = urlDetails(url);
        if (timeoutSeconds != null) {
            details.put("timeout_seconds", timeoutSeconds);
        }
        return new ScrapeException(ErrorKind.TIMEOUT, message, details);
    }

    public static ScrapeException browser(String message, String url, String browserError) {
        Map<String, Object> details = urlDetails(url);
        if (browserError != null) {
            details.put("browser_error", browserError);
        }
        return new ScrapeException(ErrorKind.BROWSER, message, details);
    }

    public static ScrapeException contentProcessing(String message, String stage) {
        return contentProcessing(message, stage, null);
    }

    public static ScrapeException contentProcessing(String message, String stage, Throwable cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (stage != null) {
            details.put("processing_stage", stage);
        }
        return new ScrapeException(ErrorKind.CONTENT_PROCESSING, message, details, cause);
    }

    /**
     * Copy of this failure with {@code url} added to its details.
     */
    public ScrapeException withUrl(String url) {
        if (url == null || details.containsKey("url")) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put("url", url);
        return new ScrapeException(kind, getMessage(), merged, getCause());
    }

    private static Map<String, Object> urlDetails(String url) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (url != null) {
            details.put("url", url);
        }
        return details;
    }

}
