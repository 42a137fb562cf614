package fun.fengwk.msh.core.service.scrape.model;

import org.apache.commons.lang3.StringUtils;

/**
 * Supported scrape output formats.
 *
 * @author fengwk
 */
public enum OutputFormat {

    MARKDOWN("markdown"),
    HTML("html"),
    BOTH("both");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean includesMarkdown() {
        return this == MARKDOWN || this == BOTH;
    }

    public boolean includesHtml() {
        return this == HTML || this == BOTH;
    }

    public static OutputFormat fromValue(String value) {
        if (StringUtils.isBlank(value)) {
            return MARKDOWN;
        }
        for (OutputFormat format : values()) {
            if (format.value.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("unsupported output_format: " + value);
    }

}
