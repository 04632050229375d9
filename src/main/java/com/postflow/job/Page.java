package com.postflow.job;

import java.util.List;

/**
 * One page of results.
 *
 * @param items         Items on this page
 * @param page          Page index, zero-based
 * @param size          Requested page size
 * @param totalElements Items across all pages
 */
public record Page<T>(List<T> items, int page, int size, long totalElements) {

    public Page {
        items = List.copyOf(items);
    }

    public static <T> Page<T> of(List<T> all, PageRequest request) {
        int from = Math.min(request.offset(), all.size());
        int to = Math.min(from + request.size(), all.size());
        return new Page<>(all.subList(from, to), request.page(), request.size(), all.size());
    }

    public int totalPages() {
        return (int) ((totalElements + size - 1) / size);
    }

    public boolean hasNext() {
        return page + 1 < totalPages();
    }
}
