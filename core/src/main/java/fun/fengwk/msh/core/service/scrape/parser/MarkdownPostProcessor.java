package fun.fengwk.msh.core.service.scrape.parser;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Post-process markdown output.
 *
 * <p>The cleanup steps run in a fixed order and the whole sequence is repeated until the text stops
 * changing, so {@code process(process(x)).equals(process(x))} holds for any input.
 *
 * @author fengwk
 */
@Component
public class MarkdownPostProcessor {

    static final int MAX_PASSES = 64;

    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");
    private static final Pattern SPACES_BEFORE_NEWLINE = Pattern.compile(" +\n");
    private static final Pattern EMPTY_LINK = Pattern.compile("\\[]\\([^)]*\\)");
    private static final Pattern EMPTY_BRACKET_LINE = Pattern.compile("(?md)^\\[]\\s*$");
    private static final Pattern HORIZONTAL_RULE = Pattern.compile("(?md)^[-_]{3,}$");
    private static final Pattern EMPTY_HEADER = Pattern.compile("(?md)^#+\\s*$");
    private static final Pattern TRIPLE_BLANK_RUN = Pattern.compile("\n\\s*\n\\s*\n");
    private static final Pattern BULLET_MARKER = Pattern.compile("(?md)^[*\\-+]\\s+");
    private static final Pattern HEADER_SPACING = Pattern.compile("(?md)^(#{1,6})\\s*(.+)$");

    public String process(String markdown) {
        if (StringUtils.isBlank(markdown)) {
            return "";
        }
        String current = markdown.replace("\r\n", "\n")
            .replace('\r', '\n')
            .replace("\uFEFF", "")
            .replace("\u200B", "")
            .replace("\u2060", "");
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = cleanOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    String cleanOnce(String markdown) {
        String result = EXCESS_NEWLINES.matcher(markdown).replaceAll("\n\n");
        result = SPACES_BEFORE_NEWLINE.matcher(result).replaceAll("\n");
        result = EMPTY_LINK.matcher(result).replaceAll("");
        result = EMPTY_BRACKET_LINE.matcher(result).replaceAll("");
        result = HORIZONTAL_RULE.matcher(result).replaceAll("---");
        result = EMPTY_HEADER.matcher(result).replaceAll("");
        result = TRIPLE_BLANK_RUN.matcher(result).replaceAll("\n\n");
        result = stripLineEnds(result).strip();
        result = BULLET_MARKER.matcher(result).replaceAll("- ");
        return HEADER_SPACING.matcher(result).replaceAll("$1 $2").strip();
    }

    private String stripLineEnds(String markdown) {
        String[] lines = markdown.split("\n", -1);
        StringBuilder builder = new StringBuilder(markdown.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                builder.append('\n');
            }
            builder.append(StringUtils.stripEnd(lines[i], null));
        }
        return builder.toString();
    }

}
