package com.findly.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class Pagination {
    private int page;
    private int limit;

    @JsonProperty("total_pages")
    private long totalPages;

    @JsonProperty("has_next")
    private boolean hasNext;

    @JsonProperty("has_previous")
    private boolean hasPrevious;

    public static Pagination of(int page, int limit, long totalCount) {
        Pagination pagination = new Pagination();
        long pages = limit <= 0 ? 0 : (totalCount + limit - 1) / limit;
        pagination.setPage(page);
        pagination.setLimit(limit);
        pagination.setTotalPages(pages);
        pagination.setHasNext(page < pages);
        pagination.setHasPrevious(page > 1);
        return pagination;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public long getTotalPages() {
        return totalPages;
    }

    public void setTotalPages(long totalPages) {
        this.totalPages = totalPages;
    }

    public boolean isHasNext() {
        return hasNext;
    }

    public void setHasNext(boolean hasNext) {
        this.hasNext = hasNext;
    }

    public boolean isHasPrevious() {
        return hasPrevious;
    }

    public void setHasPrevious(boolean hasPrevious) {
        this.hasPrevious = hasPrevious;
    }
}
