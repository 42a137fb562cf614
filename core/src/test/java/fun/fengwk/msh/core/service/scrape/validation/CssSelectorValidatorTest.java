package fun.fengwk.msh.core.service.scrape.validation;

import fun.fengwk.msh.core.service.scrape.ScrapeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class CssSelectorValidatorTest {

    private final CssSelectorValidator cssSelectorValidator = new CssSelectorValidator();

    @Test
    public void shouldAcceptCommonSelectors() {
        assertThat(cssSelectorValidator.isValid(".ads")).isTrue();
        assertThat(cssSelectorValidator.isValid("#comments")).isTrue();
        assertThat(cssSelectorValidator.isValid("div.content > p:first-child")).isTrue();
        assertThat(cssSelectorValidator.isValid("a[href*='track']")).isTrue();
        assertThat(cssSelectorValidator.isValid("ul li + li, h1 ~ p")).isTrue();
    }

    @Test
    public void shouldRejectDangerousOrMalformedSelectors() {
        assertThat(cssSelectorValidator.isValid(null)).isFalse();
        assertThat(cssSelectorValidator.isValid(" ")).isFalse();
        assertThat(cssSelectorValidator.isValid("a[href='javascript:alert(1)']")).isFalse();
        assertThat(cssSelectorValidator.isValid("eval(x)")).isFalse();
        assertThat(cssSelectorValidator.isValid("<SCRIPT>")).isFalse();
        assertThat(cssSelectorValidator.isValid("img[onerror=x]")).isFalse();
        assertThat(cssSelectorValidator.isValid("div{color:red}")).isFalse();
        assertThat(cssSelectorValidator.isValid("a".repeat(201))).isFalse();
    }

    @Test
    public void shouldDropInvalidSelectors() {
        List<String> valid = cssSelectorValidator.validateAll(Arrays.asList(".ads", "eval(1)", null, "nav"));

        assertThat(valid).containsExactly(".ads", "nav");
    }

    @Test
    public void shouldReturnEmptyForMissingSelectors() {
        assertThat(cssSelectorValidator.validateAll(null)).isEmpty();
        assertThat(cssSelectorValidator.validateAll(List.of())).isEmpty();
    }

    @Test
    public void shouldRejectTooManySelectors() {
        List<String> selectors = new ArrayList<>();
        for (int i = 0; i < 51; i++) {
            selectors.add(".c" + i);
        }

        assertThatThrownBy(() -> cssSelectorValidator.validateAll(selectors))
            .isInstanceOf(ScrapeException.class)
            .hasMessage("Too many CSS selectors (max 50)");
    }

}
