package fun.fengwk.msh.core.service.browser;

/**
 * Html and title of a rendered page, title is empty when it was not requested.
 *
 * @author fengwk
 */
public record RenderedPage(String html, String title) {

}
