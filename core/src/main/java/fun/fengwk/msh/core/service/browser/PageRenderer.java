package fun.fengwk.msh.core.service.browser;

import fun.fengwk.msh.core.service.scrape.ScrapeException;

/**
 * Loads a page in a browser engine until its DOM content is loaded.
 *
 * <p>Implementations must not share page state between calls, concurrent renders of different urls
 * are expected.
 *
 * @author fengwk
 */
public interface PageRenderer {

    /**
     * Render one url.
     *
     * @param request render request
     * @return page html and title
     * @throws ScrapeException of kind network, timeout or browser
     */
    RenderedPage render(RenderRequest request);

}
