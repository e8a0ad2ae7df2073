/* (C)2026 */
package com.ammann.logquery.dto;

/**
 * Offset-based pagination of the row query.
 *
 * <p>Pages are 1-indexed. Default values:
 * <ul>
 *   <li>page = 1</li>
 *   <li>pageSize = 100</li>
 *   <li>max pageSize = 1000 (memory exhaustion prevention)</li>
 * </ul>
 *
 * @param page 1-indexed page number
 * @param pageSize rows per page
 */
public record PageRequestDTO(int page, int pageSize) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int MAX_PAGE_SIZE = 1000;

    public static PageRequestDTO defaults() {
        return new PageRequestDTO(DEFAULT_PAGE, DEFAULT_PAGE_SIZE);
    }

    /**
     * Calculate the offset for database queries.
     *
     * @return The number of records to skip
     */
    public long getOffset() {
        return (long) (page - 1) * pageSize;
    }

    /**
     * Get the limit for database queries.
     *
     * @return The number of records to fetch
     */
    public int getLimit() {
        return pageSize;
    }
}
