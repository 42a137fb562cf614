package fun.fengwk.msh.core.service.scrape.parser;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extract page level metadata from html.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class MetadataExtractor {

    public static final String DESCRIPTION = "description";
    public static final String KEYWORDS = "keywords";
    public static final String AUTHOR = "author";
    public static final String PUBLISHED_DATE = "published_date";
    public static final String CANONICAL_URL = "canonical_url";
    public static final String LANGUAGE = "language";

    private static final List<String> PUBLISHED_DATE_SELECTORS = List.of(
        "meta[property=article:published_time]",
        "meta[name=publication_date]",
        "meta[name=date]",
        "time[datetime]"
    );

    public Map<String, String> extract(String html) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (StringUtils.isBlank(html)) {
            return metadata;
        }
        try {
            Document document = Jsoup.parse(html);
            putIfPresent(metadata, DESCRIPTION, attr(document.selectFirst("meta[name=description]"), "content"));
            putIfPresent(metadata, KEYWORDS, attr(document.selectFirst("meta[name=keywords]"), "content"));
            putIfPresent(metadata, AUTHOR, attr(document.selectFirst("meta[name=author]"), "content"));
            putIfPresent(metadata, PUBLISHED_DATE, findPublishedDate(document));
            putIfPresent(metadata, CANONICAL_URL, attr(document.selectFirst("link[rel=canonical]"), "href"));
            putIfPresent(metadata, LANGUAGE, attr(document.selectFirst("html"), "lang"));
        } catch (RuntimeException ex) {
            log.warn("extract metadata failed, error={}", ex.getMessage());
        }
        return metadata;
    }

    private String findPublishedDate(Document document) {
        for (String selector : PUBLISHED_DATE_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element == null) {
                continue;
            }
            String value = StringUtils.defaultIfBlank(attr(element, "content"), attr(element, "datetime"));
            if (StringUtils.isNotBlank(value)) {
                return value;
            }
        }
        return null;
    }

    private String attr(Element element, String name) {
        if (element == null || !element.hasAttr(name)) {
            return null;
        }
        return element.attr(name).trim();
    }

    private void putIfPresent(Map<String, String> metadata, String key, String value) {
        if (StringUtils.isNotBlank(value)) {
            metadata.put(key, value);
        }
    }

}
