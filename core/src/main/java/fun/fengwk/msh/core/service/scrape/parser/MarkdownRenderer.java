package fun.fengwk.msh.core.service.scrape.parser;

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Html to markdown renderer driven by {@link MarkdownConversionOptions}.
 *
 * <p>Link, image and emphasis rules are applied on the parsed document before flexmark sees it, so
 * one converter setup serves every option set.
 *
 * @author fengwk
 */
@Component
public class MarkdownRenderer {

    private static final Map<String, String> ASCII_REPLACEMENTS = Map.of(
        "\u201C", "\"",
        "\u201D", "\"",
        "\u2018", "'",
        "\u2019", "'",
        "\u2013", "-",
        "\u2014", "--",
        "\u2026", "...",
        "\u00A0", " "
    );

    private final FlexmarkHtmlConverter converter;

    public MarkdownRenderer() {
        MutableDataSet options = new MutableDataSet();
        options.set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false);
        options.set(FlexmarkHtmlConverter.UNORDERED_LIST_DELIMITER, '*');
        options.set(FlexmarkHtmlConverter.LIST_ITEM_INDENT, 4);
        options.set(FlexmarkHtmlConverter.LIST_CONTENT_INDENT, true);
        options.set(FlexmarkHtmlConverter.DIV_AS_PARAGRAPH, true);
        // Typography is left alone here, ascii transliteration is an option of its own.
        options.set(FlexmarkHtmlConverter.TYPOGRAPHIC_QUOTES, false);
        options.set(FlexmarkHtmlConverter.TYPOGRAPHIC_SMARTS, false);
        this.converter = FlexmarkHtmlConverter.builder(options).build();
    }

    public String render(String html) {
        return render(html, MarkdownConversionOptions.defaults());
    }

    public String render(String html, MarkdownConversionOptions options) {
        if (StringUtils.isBlank(html)) {
            return "";
        }
        Document document = Jsoup.parse(html);
        applyRules(document, options);
        Element body = document.body();
        String markdown = converter.convert(body == null ? document.html() : body.html());
        if (!options.isUnicodeSnob()) {
            markdown = toAscii(markdown);
        }
        if (options.getBodyWidth() > 0) {
            markdown = wrap(markdown, options.getBodyWidth());
        }
        return markdown;
    }

    private void applyRules(Document document, MarkdownConversionOptions options) {
        document.select("script, style, noscript, meta, head").remove();
        if (options.isIgnoreImages()) {
            document.select("img, picture, svg").remove();
        }
        if (options.isIgnoreLinks()) {
            unwrapAll(document, "a");
        } else if (options.isSkipInternalLinks()) {
            unwrapAll(document, "a[href^=#]");
        }
        if (options.isIgnoreEmphasis()) {
            unwrapAll(document, "em, i, strong, b");
        }
    }

    private void unwrapAll(Document document, String selector) {
        // Snapshot first, unwrap mutates the tree the selection came from.
        for (Element element : new ArrayList<>(document.select(selector))) {
            element.unwrap();
        }
    }

    private String toAscii(String markdown) {
        String result = markdown;
        for (Map.Entry<String, String> entry : ASCII_REPLACEMENTS.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }

    private String wrap(String markdown, int width) {
        StringBuilder wrapped = new StringBuilder();
        boolean inCodeBlock = false;
        for (String line : markdown.split("\n", -1)) {
            if (line.trim().startsWith("```")) {
                inCodeBlock = !inCodeBlock;
            }
            if (inCodeBlock || line.length() <= width || !isParagraphLine(line)) {
                wrapped.append(line).append('\n');
                continue;
            }
            for (String wrappedLine : wrapLine(line, width)) {
                wrapped.append(wrappedLine).append('\n');
            }
        }
        return wrapped.substring(0, wrapped.length() - 1);
    }

    private boolean isParagraphLine(String line) {
        if (line.isEmpty() || Character.isWhitespace(line.charAt(0))) {
            return false;
        }
        char first = line.charAt(0);
        return first != '#' && first != '|' && first != '>' && first != '*' && first != '-' && first != '+'
            && !Character.isDigit(first);
    }

    private List<String> wrapLine(String line, int width) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : StringUtils.split(line)) {
            if (current.length() > 0 && current.length() + 1 + word.length() > width) {
                lines.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }

}
