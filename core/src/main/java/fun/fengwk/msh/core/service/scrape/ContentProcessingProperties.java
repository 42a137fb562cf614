package fun.fengwk.msh.core.service.scrape;

import fun.fengwk.msh.core.service.scrape.parser.MarkdownConversionOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Content normalization configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.content")
public class ContentProcessingProperties {

    private boolean ignoreLinks = true;

    private boolean ignoreImages = true;

    /**
     * Wrap width for markdown paragraphs, 0 disables wrapping.
     */
    private int bodyWidth = 0;

    /**
     * Keep unicode punctuation instead of transliterating it to ascii.
     */
    private boolean unicodeSnob = true;

    private boolean ignoreEmphasis = false;

    /**
     * Drop in-page anchor links such as {@code #section}.
     */
    private boolean skipInternalLinks = true;

    /**
     * Max html length in characters accepted for normalization.
     */
    private long maxContentLength = 20_000_000L;

    /**
     * Markdown shorter than this is logged as suspicious, never rejected.
     */
    private int minContentLength = 100;

    public MarkdownConversionOptions toConversionOptions() {
        return MarkdownConversionOptions.builder()
            .ignoreLinks(ignoreLinks)
            .ignoreImages(ignoreImages)
            .bodyWidth(bodyWidth)
            .unicodeSnob(unicodeSnob)
            .ignoreEmphasis(ignoreEmphasis)
            .skipInternalLinks(skipInternalLinks)
            .build();
    }

}
