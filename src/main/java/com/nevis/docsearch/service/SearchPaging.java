package com.nevis.docsearch.service;

/**
 * Normalized page coordinates. Missing, non-numeric or out-of-range input falls back to
 * defaults instead of failing the request.
 */
public record SearchPaging(int page, int perPage) {

    public static SearchPaging of(Integer page, Integer perPage, int defaultPerPage, int maxPerPage) {
        int resolvedPage = page == null || page < 1 ? 1 : page;
        int resolvedPerPage = perPage == null || perPage < 1 ? defaultPerPage : Math.min(perPage, maxPerPage);
        return new SearchPaging(resolvedPage, resolvedPerPage);
    }

    /**
     * Lenient integer parsing for query parameters; anything unparsable becomes {@code null}.
     */
    public static Integer parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public int offset() {
        return (int) Math.min(Integer.MAX_VALUE, (long) (page - 1) * perPage);
    }
}
