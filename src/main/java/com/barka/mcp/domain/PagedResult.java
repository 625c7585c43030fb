package com.barka.mcp.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PagedResult<T>(
        List<T> items,
        long total,
        int page,
        int limit,
        @JsonProperty("has_more") boolean hasMore
) {
    public static <T> PagedResult<T> of(List<T> all, PageRequest request) {
        int page = request.pageOrDefault();
        int limit = request.limitOrDefault();
        int from = offset(page, limit, all.size());
        int to = (int) Math.min((long) from + limit, all.size());
        return new PagedResult<>(List.copyOf(all.subList(from, to)), all.size(), page, limit, to < all.size());
    }

    /** Start index of a page, clamped to {@code size}. Computed in long so a huge page cannot wrap. */
    public static int offset(int page, int limit, int size) {
        return (int) Math.min((long) (page - 1) * limit, size);
    }
}
