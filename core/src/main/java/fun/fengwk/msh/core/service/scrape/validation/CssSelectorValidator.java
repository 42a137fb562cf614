package fun.fengwk.msh.core.service.scrape.validation;

import fun.fengwk.msh.core.service.scrape.ScrapeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates user supplied css selectors for {@code remove_elements}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class CssSelectorValidator {

    public static final int MAX_SELECTOR_LENGTH = 200;

    public static final int MAX_SELECTOR_COUNT = 50;

    private static final List<String> DANGEROUS_PATTERNS = List.of(
        "javascript:",
        "eval(",
        "<script",
        "</script>",
        "onclick=",
        "onerror=",
        "onload="
    );

    private static final Pattern SELECTOR_PATTERN = Pattern.compile("^[a-zA-Z0-9\\s.#\\[\\]:\\-_,>+~*=\"'()]+$");

    public boolean isValid(String selector) {
        if (selector == null || selector.isBlank()) {
            return false;
        }
        if (selector.length() > MAX_SELECTOR_LENGTH) {
            return false;
        }
        String lowerCaseSelector = selector.toLowerCase(Locale.ROOT);
        for (String pattern : DANGEROUS_PATTERNS) {
            if (lowerCaseSelector.contains(pattern)) {
                return false;
            }
        }
        return SELECTOR_PATTERN.matcher(selector).matches();
    }

    /**
     * Keeps valid selectors in order and drops the rest.
     *
     * @throws ScrapeException when more than {@value #MAX_SELECTOR_COUNT} selectors are given
     */
    public List<String> validateAll(Collection<String> selectors) {
        if (selectors == null || selectors.isEmpty()) {
            return List.of();
        }
        if (selectors.size() > MAX_SELECTOR_COUNT) {
            throw ScrapeException.validation(
                "Too many CSS selectors (max " + MAX_SELECTOR_COUNT + ")", "remove_elements", selectors.size());
        }
        List<String> valid = new ArrayList<>();
        for (String selector : selectors) {
            if (isValid(selector)) {
                valid.add(selector);
            } else {
                log.warn("invalid css selector ignored, selector={}", selector);
            }
        }
        return valid;
    }

}
