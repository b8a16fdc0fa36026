package com.reportwheel.model.view;

import lombok.Getter;

import java.util.List;
import java.util.function.Function;

@Getter
public class PageResult<T> {

    private final List<T> items;

    private final int page;

    private final int limit;

    private final long total;

    private final long totalPages;

    private final boolean hasNextPage;

    private final boolean hasPrevPage;

    public PageResult(List<T> items, int page, int limit, long total) {
        this.items = items;
        this.page = page;
        this.limit = limit;
        this.total = total;
        this.totalPages = limit <= 0 ? 0 : (total + limit - 1) / limit;
        this.hasNextPage = page < totalPages;
        this.hasPrevPage = page > 1;
    }

    public <R> PageResult<R> map(Function<T, R> fn) {
        return new PageResult<>(items.stream().map(fn).toList(), page, limit, total);
    }
}
