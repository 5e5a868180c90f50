package com.github.dimitryivaniuta.querycache.sample.dto;

/**
 * Search criteria; every component becomes a segment of the cache key.
 * Blank filters are left out of the key, so "no filter" and "blank filter" share an entry.
 */
public record EmployeeQuery(
        int page,
        int size,
        String lastName,
        String position
) {}
