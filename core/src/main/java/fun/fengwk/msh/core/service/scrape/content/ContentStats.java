package fun.fengwk.msh.core.service.scrape.content;

import lombok.Builder;
import lombok.Value;

/**
 * Counting statistics of a markdown text.
 *
 * @author fengwk
 */
@Value
@Builder
public class ContentStats {

    int characters;
    int words;
    int lines;
    int headers;
    int links;
    int codeBlocks;

}
