package fun.fengwk.msh.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import org.apache.commons.lang3.StringUtils;

/**
 * Stealth script helper for browser context.
 *
 * @author fengwk
 */
public final class BrowserStealthSupport {

    static final String DEFAULT_STEALTH_SCRIPT = """
        (() => {
          try {
            Object.defineProperty(navigator, 'webdriver', { get: () => undefined });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'languages', { get: () => ['en-US', 'en'] });
          } catch (e) {}
          try {
            window.chrome = window.chrome || { runtime: {} };
          } catch (e) {}
        })();
        """;

    private BrowserStealthSupport() {
    }

    public static void apply(BrowserContext context, BrowserProperties properties) {
        String script = properties.resolveStealthScript();
        if (StringUtils.isBlank(script)) {
            return;
        }
        context.addInitScript(script);
    }

}
