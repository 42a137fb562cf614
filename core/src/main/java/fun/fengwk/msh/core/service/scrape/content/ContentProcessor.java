package fun.fengwk.msh.core.service.scrape.content;

import fun.fengwk.msh.core.service.scrape.ContentProcessingProperties;
import fun.fengwk.msh.core.service.scrape.ScrapeException;
import fun.fengwk.msh.core.service.scrape.model.OutputFormat;
import fun.fengwk.msh.core.service.scrape.parser.HtmlCleaner;
import fun.fengwk.msh.core.service.scrape.parser.MarkdownConversionOptions;
import fun.fengwk.msh.core.service.scrape.parser.MarkdownPostProcessor;
import fun.fengwk.msh.core.service.scrape.parser.MarkdownRenderer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns rendered page html into cleaned html and/or markdown.
 *
 * <p>Every failure is raised as a content processing {@link ScrapeException} whose
 * {@code processing_stage} detail names the step that failed.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ContentProcessor {

    public static final String STAGE_VALIDATION = "validation";
    public static final String STAGE_ELEMENT_REMOVAL = "element_removal";
    public static final String STAGE_HTML_CLEANING = "html_cleaning";
    public static final String STAGE_HTML_TO_MARKDOWN = "html_to_markdown";

    static final String ELLIPSIS = "\u2026";

    private static final Pattern MARKDOWN_PUNCTUATION = Pattern.compile("[#*_`\\[\\]()]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HEADER = Pattern.compile("(?m)^#+");
    private static final Pattern LINK = Pattern.compile("\\[.*?]\\(.*?\\)");
    private static final String CODE_FENCE = "```";

    private final ContentProcessingProperties properties;
    private final HtmlCleaner htmlCleaner;
    private final MarkdownRenderer markdownRenderer;
    private final MarkdownPostProcessor markdownPostProcessor;
    private final MarkdownConversionOptions conversionOptions;

    public ContentProcessor(
        ContentProcessingProperties properties,
        HtmlCleaner htmlCleaner,
        MarkdownRenderer markdownRenderer,
        MarkdownPostProcessor markdownPostProcessor
    ) {
        this.properties = properties;
        this.htmlCleaner = htmlCleaner;
        this.markdownRenderer = markdownRenderer;
        this.markdownPostProcessor = markdownPostProcessor;
        this.conversionOptions = properties.toConversionOptions();
    }

    public ProcessedContent process(String html, String title, OutputFormat outputFormat) {
        return process(html, title, outputFormat, List.of());
    }

    public ProcessedContent process(
        String html,
        String title,
        OutputFormat outputFormat,
        Collection<String> removeSelectors
    ) {
        OutputFormat format = outputFormat == null ? OutputFormat.MARKDOWN : outputFormat;
        String source = html == null ? "" : html;
        if (source.length() > properties.getMaxContentLength()) {
            throw ScrapeException.contentProcessing(
                "Content too large (max " + properties.getMaxContentLength() + " characters)", STAGE_VALIDATION);
        }

        if (removeSelectors != null && !removeSelectors.isEmpty()) {
            source = runStage(STAGE_ELEMENT_REMOVAL, source, s -> htmlCleaner.removeElements(s, removeSelectors));
        }

        String cleanedHtml = null;
        if (format.includesHtml()) {
            cleanedHtml = runStage(STAGE_HTML_CLEANING, source, htmlCleaner::clean);
        }
        String markdown = null;
        if (format.includesMarkdown()) {
            markdown = runStage(STAGE_HTML_TO_MARKDOWN, source, this::toMarkdown);
            markdown = prependTitle(markdown, title);
            if (markdown.length() < properties.getMinContentLength()) {
                log.warn("markdown content shorter than expected, length={}, min={}",
                    markdown.length(), properties.getMinContentLength());
            }
        }
        return new ProcessedContent(markdown, cleanedHtml);
    }

    /**
     * Plain text summary of a markdown text, at most {@code maxLength} characters plus an ellipsis.
     */
    public String summarize(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (maxLength <= 0) {
            return "";
        }
        String plain = MARKDOWN_PUNCTUATION.matcher(text).replaceAll("");
        plain = WHITESPACE.matcher(plain).replaceAll(" ").trim();
        if (plain.length() <= maxLength) {
            return plain;
        }

        String truncated = plain.substring(0, maxLength);
        int sentenceEnd = Math.max(truncated.lastIndexOf('.'),
            Math.max(truncated.lastIndexOf('!'), truncated.lastIndexOf('?')));
        if (sentenceEnd >= 0 && sentenceEnd >= maxLength * 0.7) {
            return truncated.substring(0, sentenceEnd + 1);
        }
        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace >= 0 && lastSpace >= maxLength * 0.8) {
            return truncated.substring(0, lastSpace) + ELLIPSIS;
        }
        return truncated + ELLIPSIS;
    }

    public ContentStats stats(String text) {
        String content = text == null ? "" : text;
        ContentStats.ContentStatsBuilder builder = ContentStats.builder()
            .characters(content.length())
            .words(StringUtils.split(content).length)
            .lines(content.split("\n", -1).length);
        try {
            builder.headers(count(HEADER.matcher(content)))
                .links(count(LINK.matcher(content)))
                .codeBlocks(StringUtils.countMatches(content, CODE_FENCE) / 2);
        } catch (RuntimeException ex) {
            log.warn("count markdown elements failed, error={}", ex.getMessage());
            builder.headers(0).links(0).codeBlocks(0);
        }
        return builder.build();
    }

    private String toMarkdown(String html) {
        String rendered = markdownRenderer.render(html, conversionOptions);
        return markdownPostProcessor.process(rendered);
    }

    private String prependTitle(String markdown, String title) {
        if (StringUtils.isBlank(title)) {
            return markdown;
        }
        String heading = "# " + title.trim();
        return markdown.isEmpty() ? heading : heading + "\n\n" + markdown;
    }

    private int count(Matcher matcher) {
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private String runStage(String stage, String input, Stage step) {
        try {
            return step.apply(input);
        } catch (ScrapeException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("content processing failed, stage={}, error={}", stage, ex.getMessage());
            throw ScrapeException.contentProcessing(
                "Error in " + stage.replace('_', ' ') + ": " + ex.getMessage(), stage, ex);
        } catch (StackOverflowError ex) {
            // Recursive converters overflow on deeply nested markup.
            log.warn("content processing overflowed, stage={}", stage);
            throw ScrapeException.contentProcessing(
                "Error in " + stage.replace('_', ' ') + ": document nesting too deep", stage, ex);
        }
    }

    @FunctionalInterface
    private interface Stage {

        String apply(String input);

    }

}
