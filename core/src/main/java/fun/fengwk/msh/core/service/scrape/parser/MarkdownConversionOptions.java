package fun.fengwk.msh.core.service.scrape.parser;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable html to markdown conversion rules.
 *
 * @author fengwk
 */
@Value
@Builder
public class MarkdownConversionOptions {

    @Builder.Default
    boolean ignoreLinks = true;

    @Builder.Default
    boolean ignoreImages = true;

    /**
     * Wrap width for paragraph lines, 0 means no wrapping.
     */
    @Builder.Default
    int bodyWidth = 0;

    @Builder.Default
    boolean unicodeSnob = true;

    @Builder.Default
    boolean ignoreEmphasis = false;

    @Builder.Default
    boolean skipInternalLinks = true;

    public static MarkdownConversionOptions defaults() {
        return MarkdownConversionOptions.builder().build();
    }

}
