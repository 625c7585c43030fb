package com.barka.mcp.domain;

/**
 * Pagination as requested. Null members mean "use the service default".
 */
public record PageRequest(Integer page, Integer limit) {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 20;

    public static PageRequest unspecified() {
        return new PageRequest(null, null);
    }

    public int pageOrDefault() {
        return page != null ? page : DEFAULT_PAGE;
    }

    public int limitOrDefault() {
        return limit != null ? limit : DEFAULT_LIMIT;
    }
}
