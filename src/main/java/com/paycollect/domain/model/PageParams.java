package com.paycollect.domain.model;

import lombok.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Resolved, 1-based page request.
 */
@Value
public class PageParams {

    int page;
    int limit;

    public long getOffset() {
        return (long) (page - 1) * limit;
    }

    public Pageable toPageable() {
        return PageRequest.of(page - 1, limit);
    }

    public Pageable toPageable(Sort sort) {
        return PageRequest.of(page - 1, limit, sort);
    }
}
