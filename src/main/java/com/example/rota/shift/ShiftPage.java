package com.example.rota.shift;

import java.util.List;

public record ShiftPage(List<ShiftView> shifts, Pagination pagination) {

    public record Pagination(int currentPage,
                             int totalPages,
                             long totalCount,
                             boolean hasNextPage,
                             boolean hasPrevPage,
                             int limit) {

        public static Pagination of(int page, int limit, long totalCount) {
            int totalPages = (int) ((totalCount + limit - 1) / limit);
            return new Pagination(page, totalPages, totalCount, page < totalPages, page > 1, limit);
        }
    }
}
