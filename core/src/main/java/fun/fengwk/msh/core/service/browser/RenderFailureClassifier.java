package fun.fengwk.msh.core.service.browser;

import com.microsoft.playwright.TimeoutError;
import fun.fengwk.msh.core.service.scrape.ScrapeException;
import fun.fengwk.msh.core.service.scrape.model.ErrorKind;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps renderer failures to scrape error kinds.
 *
 * <p>Playwright timeouts are recognized by type. Anything else falls back to message rules, the
 * first matching rule wins:
 * <ol>
 *     <li>message contains {@code timeout}, ignoring case: timeout</li>
 *     <li>message contains {@code net::} or {@code DNS}: network</li>
 *     <li>otherwise: browser</li>
 * </ol>
 *
 * @author fengwk
 */
public final class RenderFailureClassifier {

    private RenderFailureClassifier() {
    }

    public static ErrorKind classify(Throwable failure) {
        if (failure instanceof ScrapeException scrapeException) {
            return scrapeException.getKind();
        }
        if (failure instanceof TimeoutError) {
            return ErrorKind.TIMEOUT;
        }
        return classifyMessage(failure == null ? null : failure.getMessage());
    }

    public static ErrorKind classifyMessage(String message) {
        String text = message == null ? "" : message;
        if (StringUtils.containsIgnoreCase(text, "timeout")) {
            return ErrorKind.TIMEOUT;
        }
        if (text.contains("net::") || text.contains("DNS")) {
            return ErrorKind.NETWORK;
        }
        return ErrorKind.BROWSER;
    }

    /**
     * Converts a render failure of {@code url} into a tagged {@link ScrapeException}.
     */
    public static ScrapeException toScrapeException(Throwable failure, String url, int waitTimeSeconds) {
        if (failure instanceof ScrapeException scrapeException) {
            return scrapeException.withUrl(url);
        }
        String message = failure == null ? null : failure.getMessage();
        return switch (classify(failure)) {
            case TIMEOUT -> ScrapeException.timeout("Page load timeout for " + url, url, waitTimeSeconds);
            case NETWORK -> ScrapeException.network("Network error accessing " + url + ": " + message, url);
            default -> ScrapeException.browser("Browser error for " + url + ": " + message, url, message);
        };
    }

}
