package fun.fengwk.msh.core.service.scrape.content;

/**
 * Normalized page content, each side present only when the output format asks for it.
 *
 * @author fengwk
 */
public record ProcessedContent(String content, String html) {

    /**
     * Text used for length and word counting: the markdown when present, otherwise the html.
     */
    public String measuredText() {
        return content != null ? content : html;
    }

}
