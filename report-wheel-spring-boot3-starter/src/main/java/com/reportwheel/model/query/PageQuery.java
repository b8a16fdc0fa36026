package com.reportwheel.model.query;

import lombok.Data;

/**
 * 分页参数: page >= 1, limit 1..100, 默认 20
 */
@Data
public class PageQuery {

    public static final int DEFAULT_LIMIT = 20;

    public static final int MAX_LIMIT = 100;

    private Integer page;

    private Integer limit;

    public int page() {
        return page == null || page < 1 ? 1 : page;
    }

    public int limit() {
        if (limit == null || limit < 1) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    public long offset() {
        return (long) (page() - 1) * limit();
    }
}
