package fun.fengwk.msh.core.service.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fun.fengwk.msh.core.configuration.CoreAutoConfiguration;
import fun.fengwk.msh.core.service.scrape.ScrapeException;
import fun.fengwk.msh.core.service.scrape.content.ContentProcessor;
import fun.fengwk.msh.core.service.scrape.content.ProcessedContent;
import fun.fengwk.msh.core.service.scrape.model.ErrorKind;
import fun.fengwk.msh.core.service.scrape.model.OutputFormat;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * @author fengwk
 */
@Slf4j
@ExtendWith(SpringExtension.class)
@ContextConfiguration(classes = CoreAutoConfiguration.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class PlaywrightPageRendererIT {

    private static final String ARTICLE_HTML = """
        <!doctype html>
        <html>
        <head><title>Article</title></head>
        <body>
          <nav>menu</nav>
          <main>
            <h1>Article Heading</h1>
            <p>First paragraph of the article.</p>
            <div class="ads">buy now</div>
          </main>
        </body>
        </html>
        """;

    @Autowired
    private PageRenderer pageRenderer;

    @Autowired
    private ContentProcessor contentProcessor;

    private HttpServer server;
    private String baseUrl;
    private ExecutorService executor;

    @BeforeAll
    public void setUp() throws Exception {
        assumeTrue(isPlaywrightAvailable(), "Playwright browser not installed");
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/article", exchange -> respond(exchange, ARTICLE_HTML));
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, ARTICLE_HTML);
        });
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterAll
    public void tearDown() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldRenderAndNormalizePage() {
        RenderedPage page = pageRenderer.render(RenderRequest.builder()
            .url(baseUrl + "/article")
            .waitTimeSeconds(10)
            .build());

        assertThat(page.title()).isEqualTo("Article");
        ProcessedContent processed = contentProcessor.process(
            page.html(), page.title(), OutputFormat.MARKDOWN, List.of("nav", ".ads"));
        log.info("rendered markdown:\n{}", processed.content());
        assertThat(processed.content()).startsWith("# Article");
        assertThat(processed.content()).contains("Article Heading", "First paragraph of the article.");
        assertThat(processed.content()).doesNotContain("menu", "buy now");
    }

    @Test
    public void shouldSkipTitleWhenNotRequested() {
        RenderedPage page = pageRenderer.render(RenderRequest.builder()
            .url(baseUrl + "/article")
            .waitTimeSeconds(10)
            .includeTitle(false)
            .build());

        assertThat(page.title()).isEmpty();
    }

    @Test
    public void shouldReportTimeout() {
        assertThatThrownBy(() -> pageRenderer.render(RenderRequest.builder()
            .url(baseUrl + "/slow")
            .waitTimeSeconds(1)
            .build()))
            .isInstanceOf(ScrapeException.class)
            .satisfies(ex -> assertThat(((ScrapeException) ex).getKind()).isEqualTo(ErrorKind.TIMEOUT));
    }

    @Test
    public void shouldReportNetworkFailure() {
        assertThatThrownBy(() -> pageRenderer.render(RenderRequest.builder()
            .url("http://127.0.0.1:1/")
            .waitTimeSeconds(5)
            .build()))
            .isInstanceOf(ScrapeException.class)
            .satisfies(ex -> assertThat(((ScrapeException) ex).getKind()).isEqualTo(ErrorKind.NETWORK));
    }

    private void respond(HttpExchange exchange, String body) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(200, payload.length);
        try (OutputStream outputStream = exchange.getResponseBody()) {
            outputStream.write(payload);
        }
    }

    private boolean isPlaywrightAvailable() {
        try (Playwright playwright = Playwright.create()) {
            try (Browser browser = playwright.chromium().launch(
                new BrowserType.LaunchOptions().setHeadless(true)
            )) {
                return true;
            }
        } catch (Exception ex) {
            log.warn("Playwright is not available: {}", ex.getMessage());
            return false;
        }
    }

}
