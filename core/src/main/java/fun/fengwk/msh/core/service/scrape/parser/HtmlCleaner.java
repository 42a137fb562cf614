package fun.fengwk.msh.core.service.scrape.parser;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Cleans raw page html for the html output.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class HtmlCleaner {

    private static final Pattern SCRIPT_PATTERN = Pattern.compile("<script[^>]*>.*?</script>",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern STYLE_PATTERN = Pattern.compile("<style[^>]*>.*?</style>",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern COMMENT_PATTERN = Pattern.compile("<!--.*?-->", Pattern.DOTALL);

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private static final Pattern BLANK_LINE_PATTERN = Pattern.compile("\\n\\s*\\n");

    /**
     * Strips script and style blocks and comments, then collapses whitespace.
     */
    public String clean(String html) {
        if (StringUtils.isEmpty(html)) {
            return "";
        }
        String cleaned = SCRIPT_PATTERN.matcher(html).replaceAll("");
        cleaned = STYLE_PATTERN.matcher(cleaned).replaceAll("");
        cleaned = COMMENT_PATTERN.matcher(cleaned).replaceAll("");
        cleaned = WHITESPACE_PATTERN.matcher(cleaned).replaceAll(" ");
        cleaned = BLANK_LINE_PATTERN.matcher(cleaned).replaceAll("\n");
        return cleaned.trim();
    }

    /**
     * Removes every element matched by the given selectors.
     *
     * <p>A selector jsoup cannot parse is skipped with a warning.
     */
    public String removeElements(String html, Collection<String> selectors) {
        if (StringUtils.isEmpty(html) || selectors == null || selectors.isEmpty()) {
            return html == null ? "" : html;
        }
        Document document = Jsoup.parse(html);
        int removed = 0;
        for (String selector : selectors) {
            if (StringUtils.isBlank(selector)) {
                continue;
            }
            try {
                removed += document.select(selector).remove().size();
            } catch (Selector.SelectorParseException | IllegalArgumentException ex) {
                log.warn("could not remove elements, selector={}, error={}", selector, ex.getMessage());
            }
        }
        log.debug("removed elements, selectors={}, removed={}", selectors.size(), removed);
        return document.outerHtml();
    }

}
