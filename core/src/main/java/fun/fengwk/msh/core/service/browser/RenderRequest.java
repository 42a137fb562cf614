package fun.fengwk.msh.core.service.browser;

import lombok.Builder;
import lombok.Value;

/**
 * @author fengwk
 */
@Value
@Builder
public class RenderRequest {

    String url;

    @Builder.Default
    boolean headless = true;

    /**
     * Navigation budget in seconds.
     */
    int waitTimeSeconds;

    @Builder.Default
    boolean includeTitle = true;

}
