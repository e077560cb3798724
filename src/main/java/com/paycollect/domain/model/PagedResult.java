package com.paycollect.domain.model;

import lombok.Value;

import java.util.List;

@Value
public class PagedResult<T> {

    List<T> items;
    Pagination pagination;
}
