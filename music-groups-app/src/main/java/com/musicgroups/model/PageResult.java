package com.musicgroups.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of a listing together with the pagination figures the list view needs.
 */
public record PageResult<T>(
    List<T> items,
    int totalCount,
    int pageNr,
    int pageSize,
    int maxVisiblePages
) {
    public PageResult {
        items = items != null ? List.copyOf(items) : List.of();
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
    }

    @JsonProperty
    public int nrOfPages() {
        return (int) Math.ceil((double) totalCount / pageSize);
    }

    @JsonProperty
    public int prevPageNr() {
        return Math.max(0, pageNr - 1);
    }

    @JsonProperty
    public int nextPageNr() {
        return Math.max(0, Math.min(nrOfPages() - 1, pageNr + 1));
    }

    @JsonProperty
    public int nrVisiblePages() {
        return Math.min(maxVisiblePages, nrOfPages());
    }
}
