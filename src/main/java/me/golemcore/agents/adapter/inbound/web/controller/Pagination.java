package me.golemcore.agents.adapter.inbound.web.controller;

/**
 * Page/page_size handling shared by the list endpoints. Out-of-range values
 * fall back to the defaults instead of failing the request.
 */
record Pagination(int page, int pageSize) {

    static Pagination of(Integer page, Integer pageSize, int defaultPageSize, int maxPageSize) {
        int normalizedPage = page != null && page > 0 ? page : 1;
        int normalizedSize = pageSize != null && pageSize > 0 && pageSize <= maxPageSize
                ? pageSize
                : defaultPageSize;
        return new Pagination(normalizedPage, normalizedSize);
    }

    int offset() {
        return (page - 1) * pageSize;
    }

    int totalPages(int total) {
        return (total + pageSize - 1) / pageSize;
    }

    boolean hasMore(int total) {
        return page < totalPages(total);
    }
}
