package com.example.rota.shift;

import org.springframework.data.domain.Sort;

import java.util.Map;

/**
 * Paging, filtering and ordering options for shift listings. Components left
 * {@code null} fall back to the defaults: page 1, limit 10, sort by date, no
 * status filter and a direction chosen by the caller.
 */
public record ShiftPageQuery(Integer page, Integer limit, ShiftStatus status, String sortBy, Sort.Direction sortOrder) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 1000;
    public static final String DEFAULT_SORT = "date";

    // request field name -> entity property
    private static final Map<String, String> SORTABLE = Map.ofEntries(
            Map.entry("date", "shiftDate"),
            Map.entry("startTime", "startTime"),
            Map.entry("finishTime", "finishTime"),
            Map.entry("status", "status"),
            Map.entry("title", "title"),
            Map.entry("role", "role"),
            Map.entry("numOfShiftsPerDay", "numOfShiftsPerDay"),
            Map.entry("clockInTime", "clockInTime"),
            Map.entry("clockOutTime", "clockOutTime"),
            Map.entry("createdAt", "createdAt"),
            Map.entry("updatedAt", "updatedAt")
    );

    public ShiftPageQuery {
        if (page != null && page < 1) {
            throw new IllegalArgumentException("Page number must be greater than 0");
        }
        if (limit != null && (limit < 1 || limit > MAX_LIMIT)) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIMIT);
        }
        if (sortBy != null && !sortBy.isBlank() && !SORTABLE.containsKey(sortBy)) {
            throw new IllegalArgumentException("Cannot sort shifts by '" + sortBy + "'");
        }
    }

    public static ShiftPageQuery defaults() {
        return new ShiftPageQuery(null, null, null, null, null);
    }

    /**
     * Parses the raw query string values the HTTP layer receives. A page or
     * limit that is not a number falls back to its default; a number outside
     * its range is rejected.
     */
    public static ShiftPageQuery parse(String page, String limit, String status, String sortBy, String sortOrder) {
        ShiftStatus parsedStatus = status == null || status.isBlank() ? null : ShiftStatus.fromLabel(status);
        Sort.Direction direction = null;
        if (sortOrder != null && !sortOrder.isBlank()) {
            if ("asc".equals(sortOrder)) {
                direction = Sort.Direction.ASC;
            } else if ("desc".equals(sortOrder)) {
                direction = Sort.Direction.DESC;
            } else {
                throw new IllegalArgumentException("Sort order must be 'asc' or 'desc'");
            }
        }
        return new ShiftPageQuery(numberOrNull(page), numberOrNull(limit), parsedStatus, sortBy, direction);
    }

    private static Integer numberOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            // not a number: the default applies
            return null;
        }
    }

    public int pageOrDefault() {
        return page == null ? DEFAULT_PAGE : page;
    }

    public int limitOrDefault() {
        return limit == null ? DEFAULT_LIMIT : limit;
    }

    public String sortByOrDefault() {
        return sortBy == null || sortBy.isBlank() ? DEFAULT_SORT : sortBy;
    }

    public Sort toSort(Sort.Direction defaultDirection) {
        Sort.Direction direction = sortOrder == null ? defaultDirection : sortOrder;
        return Sort.by(direction, SORTABLE.get(sortByOrDefault()));
    }
}
