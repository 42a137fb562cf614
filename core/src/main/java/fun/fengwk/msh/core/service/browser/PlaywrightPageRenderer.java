package fun.fengwk.msh.core.service.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Proxy;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.msh.core.service.scrape.ScrapeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Playwright backed {@link PageRenderer}.
 *
 * <p>Each call owns its Playwright driver, browser and context and closes them before returning,
 * so concurrent renders never see each other's cookies, storage or routes.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightPageRenderer implements PageRenderer {

    private final BrowserProperties browserProperties;

    @Override
    public RenderedPage render(RenderRequest request) {
        String url = request.getUrl();
        long startNanos = System.nanoTime();
        try (Playwright playwright = Playwright.create();
             Browser browser = playwright.chromium().launch(buildLaunchOptions(request.isHeadless()));
             BrowserContext context = browser.newContext(buildContextOptions())) {
            BrowserStealthSupport.apply(context, browserProperties);
            double timeoutMs = request.getWaitTimeSeconds() * 1000.0;
            Page page = context.newPage();
            preparePage(page, timeoutMs);

            page.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout(timeoutMs));

            String title = request.isIncludeTitle() ? page.title() : "";
            String html = page.content();
            log.debug("page rendered, url={}, htmlLength={}, costMs={}",
                url, html.length(), (System.nanoTime() - startNanos) / 1_000_000);
            return new RenderedPage(html, title);
        } catch (RuntimeException ex) {
            ScrapeException failure = RenderFailureClassifier.toScrapeException(ex, url, request.getWaitTimeSeconds());
            log.warn("render page failed, url={}, kind={}, error={}", url, failure.getKind(), ex.getMessage());
            throw failure;
        }
    }

    void preparePage(Page page, double timeoutMs) {
        // title and content share the navigation budget.
        page.setDefaultTimeout(timeoutMs);
        blockResources(page);
    }

    private void blockResources(Page page) {
        List<String> types = browserProperties.getBlockedResourceTypes();
        if (types == null || types.isEmpty()) {
            return;
        }
        Set<String> blocked = new HashSet<>(types);
        page.route("**/*", route -> {
            if (blocked.contains(route.request().resourceType())) {
                route.abort();
            } else {
                route.resume();
            }
        });
    }

    private BrowserType.LaunchOptions buildLaunchOptions(boolean headless) {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions().setHeadless(headless);
        if (browserProperties.getIgnoreDefaultArgs() != null && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        if (StringUtils.isNotBlank(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }
        if (StringUtils.isNotBlank(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }
        if (StringUtils.isNotBlank(browserProperties.getProxyServer())) {
            Proxy proxy = new Proxy(browserProperties.getProxyServer());
            if (StringUtils.isNotBlank(browserProperties.getProxyUsername())) {
                proxy.setUsername(browserProperties.getProxyUsername());
            }
            if (StringUtils.isNotBlank(browserProperties.getProxyPassword())) {
                proxy.setPassword(browserProperties.getProxyPassword());
            }
            options.setProxy(proxy);
        }
        return options;
    }

    private Browser.NewContextOptions buildContextOptions() {
        Browser.NewContextOptions options = new Browser.NewContextOptions();
        String userAgent = resolveUserAgent();
        if (StringUtils.isNotBlank(userAgent)) {
            options.setUserAgent(userAgent);
        }
        if (StringUtils.isNotBlank(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.isNotBlank(browserProperties.getTimezoneId())) {
            options.setTimezoneId(browserProperties.getTimezoneId());
        }

        Map<String, String> headers = new HashMap<>();
        if (browserProperties.getExtraHeaders() != null) {
            browserProperties.getExtraHeaders().forEach((key, value) -> {
                if (StringUtils.isNotBlank(key) && StringUtils.isNotBlank(value)) {
                    headers.put(key, value);
                }
            });
        }
        if (StringUtils.isNotBlank(browserProperties.getAcceptLanguage())) {
            headers.putIfAbsent("Accept-Language", browserProperties.getAcceptLanguage());
        }
        if (!headers.isEmpty()) {
            options.setExtraHTTPHeaders(headers);
        }
        return options;
    }

    String resolveUserAgent() {
        if (StringUtils.isNotBlank(browserProperties.getUserAgent())) {
            return browserProperties.getUserAgent();
        }
        List<String> userAgents = browserProperties.getUserAgents();
        if (userAgents == null || userAgents.isEmpty()) {
            return "";
        }
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }

}
