package fun.fengwk.msh.cli.scrape;

import fun.fengwk.msh.core.mcp.ScrapeMcp;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * @author fengwk
 */
@SpringBootApplication
public class CliScrapeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliScrapeApplication.class, args);
    }

    @Bean
    public ToolCallbackProvider scrapeTools(ScrapeMcp scrapeMcp) {
        return MethodToolCallbackProvider.builder()
            .toolObjects(scrapeMcp)
            .build();
    }

}
