package com.github.dimitryivaniuta.querycache.sample.dto;

import java.time.LocalDate;

public record Employee(
        long id,
        String firstName,
        String lastName,
        String position,
        LocalDate hiredOn
) {}
