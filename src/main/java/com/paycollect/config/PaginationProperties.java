package com.paycollect.config;

import com.paycollect.domain.model.PageParams;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults and bounds for the {@code page} / {@code limit} query parameters.
 */
@Data
@ConfigurationProperties(prefix = "app.pagination")
public class PaginationProperties {

    private int defaultPage = 1;
    private int defaultLimit = 10;
    private int maxLimit = 100;

    /**
     * Resolve raw query parameters. Absent, non-numeric or non-positive values
     * fall back to the defaults; {@code limit} is capped at {@code maxLimit}.
     */
    public PageParams resolve(String page, String limit) {
        int resolvedPage = parsePositive(page, defaultPage);
        int resolvedLimit = Math.min(parsePositive(limit, defaultLimit), maxLimit);
        return new PageParams(resolvedPage, resolvedLimit);
    }

    private static int parsePositive(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
