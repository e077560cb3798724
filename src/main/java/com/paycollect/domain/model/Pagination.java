package com.paycollect.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pagination block attached to list responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pagination {

    private int page;
    private int limit;
    private long total;
    private long totalPages;
    private boolean hasMore;

    /**
     * {@code hasMore} derived from the page number: {@code page < totalPages}.
     */
    public static Pagination byPageCount(PageParams params, long total) {
        long totalPages = totalPages(total, params.getLimit());
        return new Pagination(params.getPage(), params.getLimit(), total, totalPages, params.getPage() < totalPages);
    }

    /**
     * {@code hasMore} derived from the rows actually returned: {@code offset + returned < total}.
     */
    public static Pagination byOffset(PageParams params, long total, int returned) {
        long totalPages = totalPages(total, params.getLimit());
        return new Pagination(params.getPage(), params.getLimit(), total, totalPages,
                params.getOffset() + returned < total);
    }

    static long totalPages(long total, int limit) {
        return (total + limit - 1) / limit;
    }
}
