package fun.fengwk.msh.core.service.browser;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Browser runtime shared configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.browser")
public class BrowserProperties {

    /**
     * Optional fixed user agent for browser context.
     */
    private String userAgent = "";

    /**
     * User agent pool for random rotation.
     */
    private List<String> userAgents = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
    );

    /**
     * Optional Accept-Language header value.
     */
    private String acceptLanguage = "";

    /**
     * Optional locale for browser context.
     */
    private String locale = "";

    /**
     * Optional timezone id for browser context.
     */
    private String timezoneId = "";

    /**
     * Extra headers for browser context.
     */
    private Map<String, String> extraHeaders = Map.of();

    /**
     * Proxy server, for example http://proxy:8080.
     */
    private String proxyServer = "";

    private String proxyUsername = "";

    private String proxyPassword = "";

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of();

    /**
     * Ignore default args for browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

    /**
     * Sub-resource types aborted before they are fetched.
     */
    private List<String> blockedResourceTypes = List.of("image", "media", "font");

    private boolean stealthEnabled = true;

    /**
     * Optional stealth script, empty uses default.
     */
    private String stealthScript = "";

    public String resolveStealthScript() {
        if (!stealthEnabled) {
            return "";
        }
        if (StringUtils.isNotBlank(stealthScript)) {
            return stealthScript;
        }
        return BrowserStealthSupport.DEFAULT_STEALTH_SCRIPT;
    }

}
