package fun.fengwk.msh.core.service.scrape.validation;

import fun.fengwk.msh.core.service.scrape.ScrapeException;
import fun.fengwk.msh.core.service.scrape.ScrapeProperties;
import fun.fengwk.msh.core.service.scrape.model.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Format and safety gate for urls handed to the renderer.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class UrlValidator {

    public static final int MAX_URL_LENGTH = 2048;

    private static final int MAX_INVALID_EXAMPLES = 3;

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    private static final Set<String> BLOCKED_HOSTS = Set.of("localhost", "127.0.0.1", "0.0.0.0", "::1");

    private static final List<String> BLOCKED_EXTENSIONS = List.of(
        ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx",
        ".zip", ".rar", ".tar", ".gz", ".exe", ".dmg", ".pkg",
        ".mp3", ".mp4", ".avi", ".mov", ".wav", ".flv"
    );

    private static final List<Pattern> PRIVATE_HOST_PATTERNS = List.of(
        Pattern.compile("^10\\."),
        Pattern.compile("^172\\.1[6-9]\\."),
        Pattern.compile("^172\\.2[0-9]\\."),
        Pattern.compile("^172\\.3[0-1]\\."),
        Pattern.compile("^192\\.168\\."),
        Pattern.compile("^127\\."),
        Pattern.compile("^0\\."),
        Pattern.compile("^169\\.254\\.")
    );

    private static final List<String> SUSPICIOUS_KEYWORDS = List.of("admin", "login", "secure", "private", "internal");

    private static final Pattern URL_PATTERN = Pattern.compile(
        "^https?://"
            + "(?:(?:[A-Z0-9](?:[A-Z0-9-]{0,61}[A-Z0-9])?\\.)+[A-Z]{2,6}\\.?"
            + "|localhost"
            + "|\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})"
            + "(?::\\d+)?"
            + "(?:/?|[/?]\\S+)$",
        Pattern.CASE_INSENSITIVE
    );

    private final ScrapeProperties scrapeProperties;

    public UrlValidator(ScrapeProperties scrapeProperties) {
        this.scrapeProperties = scrapeProperties;
    }

    /**
     * Lenient check combining format and safety, never throws.
     */
    public boolean isValid(String url) {
        try {
            return isWellFormed(url) && isSafe(url);
        } catch (RuntimeException ex) {
            log.warn("url validation failed, url={}, error={}", url, ex.getMessage());
            return false;
        }
    }

    public void validateStrict(String url) {
        if (url == null) {
            throw ScrapeException.validation("URL must be a string", "url", null);
        }
        if (url.isBlank()) {
            throw ScrapeException.validation("URL cannot be empty", "url", url);
        }
        if (url.length() > MAX_URL_LENGTH) {
            throw ScrapeException.validation("URL too long (max " + MAX_URL_LENGTH + " characters)", "url", url);
        }
        if (!isWellFormed(url)) {
            throw ScrapeException.validation("Invalid URL format: " + url, "url", url);
        }
        if (!isSafe(url)) {
            throw ScrapeException.validation("URL not allowed for scraping: " + url, "url", url);
        }
    }

    /**
     * Keeps the valid urls of a batch in input order.
     *
     * @throws ScrapeException when the batch is empty, too large, has duplicates or holds no valid url
     */
    public List<String> validateBatch(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw ScrapeException.validation("URL list cannot be empty", "urls", null);
        }
        int maxBatchSize = scrapeProperties.getMaxBatchSize();
        if (urls.size() > maxBatchSize) {
            throw ScrapeException.validation("Too many URLs in batch (max " + maxBatchSize + ")", "urls", urls.size());
        }
        Set<String> seen = new HashSet<>();
        for (String url : urls) {
            if (!seen.add(url)) {
                throw ScrapeException.validation("Duplicate URLs found in request", "urls", url);
            }
        }

        List<String> valid = new ArrayList<>();
        List<Map<String, String>> invalid = new ArrayList<>();
        for (String url : urls) {
            try {
                validateStrict(url);
                valid.add(url);
            } catch (ScrapeException ex) {
                Map<String, String> example = new LinkedHashMap<>();
                example.put("url", String.valueOf(url));
                example.put("error", ex.getMessage());
                invalid.add(example);
            }
        }

        if (valid.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("field", "urls");
            details.put("invalid_count", invalid.size());
            details.put("examples", List.copyOf(invalid.subList(0, Math.min(MAX_INVALID_EXAMPLES, invalid.size()))));
            throw new ScrapeException(ErrorKind.VALIDATION, "No valid URLs found in batch", details);
        }
        if (!invalid.isEmpty()) {
            log.warn("found invalid urls in batch, invalidCount={}, invalid={}", invalid.size(), invalid);
        }
        return valid;
    }

    /**
     * Lower-cased authority of the url, or null when it cannot be parsed.
     */
    public String extractDomain(String url) {
        UriComponents uri = parseQuietly(url);
        if (uri == null || StringUtils.isBlank(uri.getHost())) {
            return null;
        }
        return authority(uri).toLowerCase(Locale.ROOT);
    }

    /**
     * Drops the fragment and lower-cases the authority, returns the input when it cannot be parsed.
     */
    public String normalize(String url) {
        UriComponents uri = parseQuietly(url == null ? null : url.trim());
        if (uri == null || uri.getScheme() == null || StringUtils.isBlank(uri.getHost())) {
            return url;
        }
        StringBuilder builder = new StringBuilder()
            .append(uri.getScheme().toLowerCase(Locale.ROOT))
            .append("://")
            .append(authority(uri).toLowerCase(Locale.ROOT));
        if (uri.getPath() != null) {
            builder.append(uri.getPath());
        }
        if (uri.getQuery() != null) {
            builder.append('?').append(uri.getQuery());
        }
        return builder.toString();
    }

    private boolean isWellFormed(String url) {
        if (url == null || !URL_PATTERN.matcher(url).matches()) {
            return false;
        }
        UriComponents uri = parseQuietly(url);
        if (uri == null || uri.getScheme() == null) {
            return false;
        }
        if (!ALLOWED_SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (StringUtils.isBlank(uri.getHost())) {
            return false;
        }
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        for (String extension : BLOCKED_EXTENSIONS) {
            if (path.endsWith(extension)) {
                return false;
            }
        }
        return true;
    }

    private boolean isSafe(String url) {
        UriComponents uri = parseQuietly(url);
        if (uri == null || StringUtils.isBlank(uri.getHost())) {
            return false;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (BLOCKED_HOSTS.contains(host) || isPrivateHost(host)) {
            return false;
        }

        // Audit signal only, these urls are still scraped.
        String lowerCaseUrl = url.toLowerCase(Locale.ROOT);
        for (String keyword : SUSPICIOUS_KEYWORDS) {
            if (host.contains(keyword) || lowerCaseUrl.contains("/" + keyword)) {
                log.warn("potentially suspicious url pattern, keyword={}, url={}", keyword, url);
            }
        }
        return true;
    }

    private boolean isPrivateHost(String host) {
        for (Pattern pattern : PRIVATE_HOST_PATTERNS) {
            if (pattern.matcher(host).find()) {
                return true;
            }
        }
        return false;
    }

    private String authority(UriComponents uri) {
        StringBuilder authority = new StringBuilder();
        if (uri.getUserInfo() != null) {
            authority.append(uri.getUserInfo()).append('@');
        }
        authority.append(uri.getHost());
        if (uri.getPort() != -1) {
            authority.append(':').append(uri.getPort());
        }
        return authority.toString();
    }

    /**
     * Splits the url into components without validating its characters, so query values such as
     * {@code a|b}, {@code {x}} or a bare {@code %} do not make an otherwise valid url unparsable.
     */
    private UriComponents parseQuietly(String url) {
        if (url == null) {
            return null;
        }
        try {
            return UriComponentsBuilder.fromUriString(url).build();
        } catch (IllegalArgumentException ex) {
            log.debug("url is not a valid uri, url={}, error={}", url, ex.getMessage());
            return null;
        }
    }

}
