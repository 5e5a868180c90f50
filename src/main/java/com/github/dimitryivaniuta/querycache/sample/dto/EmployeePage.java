package com.github.dimitryivaniuta.querycache.sample.dto;

import java.time.Instant;
import java.util.List;

public record EmployeePage(
        List<Employee> items,
        int page,
        int size,
        long total,
        Instant generatedAt
) {}
