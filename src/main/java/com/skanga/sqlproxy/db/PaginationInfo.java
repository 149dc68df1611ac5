package com.skanga.sqlproxy.db;

import com.skanga.sqlproxy.config.ResourceManager;

/**
 * Page coordinates of a listing.
 *
 * @param page       1-based page number
 * @param pageSize   Items per page, 1 to {@value #MAX_PAGE_SIZE}
 * @param totalCount Total number of items across all pages
 */
public record PaginationInfo(int page, int pageSize, int totalCount) {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int MAX_PAGE_SIZE = 100;

    public PaginationInfo {
        if (page < 1) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("request.page.invalid"));
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("request.page.size.invalid"));
        }
    }

    public int totalPages() {
        return (int) (((long) totalCount + pageSize - 1) / pageSize);
    }

    /**
     * @return Zero-based index of the first item on this page, which may lie past the last item
     */
    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
