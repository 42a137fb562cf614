package fun.fengwk.msh.core.service.scrape;

import fun.fengwk.msh.core.service.scrape.model.BatchResult;
import fun.fengwk.msh.core.service.scrape.model.ScrapeOptions;
import fun.fengwk.msh.core.service.scrape.model.ScrapeResult;

import java.util.List;

/**
 * Scrape service entry.
 *
 * <p>Neither method throws for per url problems, every failure is reported inside the returned
 * result.
 *
 * @author fengwk
 */
public interface ScrapeService {

    ScrapeResult scrapeSingle(String url, ScrapeOptions options);

    BatchResult scrapeBatch(List<String> urls, ScrapeOptions options);

}
