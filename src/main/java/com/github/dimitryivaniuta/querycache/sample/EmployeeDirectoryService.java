package com.github.dimitryivaniuta.querycache.sample;

import com.github.dimitryivaniuta.querycache.cache.interceptor.QueryCached;
import com.github.dimitryivaniuta.querycache.cache.invalidation.CacheInvalidationService;
import com.github.dimitryivaniuta.querycache.cache.provider.CacheStoreUnavailableException;
import com.github.dimitryivaniuta.querycache.sample.dto.Employee;
import com.github.dimitryivaniuta.querycache.sample.dto.EmployeePage;
import com.github.dimitryivaniuta.querycache.sample.dto.EmployeeQuery;
import com.github.dimitryivaniuta.querycache.sample.dto.HireEmployeeRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Employee directory kept in memory. Reads go through the query cache; every write drops
 * all cached search pages by prefix.
 */
@Slf4j
@Service
public class EmployeeDirectoryService {

    public static final String ENDPOINT = "Employees";

    private final CacheInvalidationService invalidation;
    private final List<Employee> employees = new CopyOnWriteArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    public EmployeeDirectoryService(CacheInvalidationService invalidation) {
        this.invalidation = invalidation;
        seed("Ada", "Lovelace", "Engineer");
        seed("Grace", "Hopper", "Architect");
        seed("Alan", "Turing", "Engineer");
        seed("Edsger", "Dijkstra", "Reviewer");
    }

    /**
     * Paged search. {@code generatedAt} changes only when the page is recomputed,
     * which makes cache hits visible to callers.
     */
    @QueryCached(endpoint = ENDPOINT)
    public EmployeePage search(EmployeeQuery query) {
        int page = Math.max(1, query.page());
        int size = Math.max(1, query.size());

        List<Employee> matches = employees.stream()
                .filter(e -> matches(e.lastName(), query.lastName()))
                .filter(e -> matches(e.position(), query.position()))
                .sorted(Comparator.comparingLong(Employee::id))
                .toList();

        List<Employee> items = matches.stream()
                .skip((long) (page - 1) * size)
                .limit(size)
                .toList();

        return new EmployeePage(items, page, size, matches.size(), Instant.now());
    }

    /**
     * Adds the employee, then drops cached search pages. The hire is already applied when
     * invalidation runs, so a store outage is logged and the stale pages age out by TTL.
     */
    public Employee hire(HireEmployeeRequest req) {
        Employee e = seed(req.firstName().trim(), req.lastName().trim(), req.position().trim());
        try {
            invalidation.invalidatePrefix(ENDPOINT);
            log.info("Hired employee id={}, search cache invalidated", e.id());
        } catch (CacheStoreUnavailableException ex) {
            log.warn("Hired employee id={}, but search cache invalidation failed ({}); cached pages expire by TTL",
                    e.id(), ex.getMessage());
        }
        return e;
    }

    private Employee seed(String firstName, String lastName, String position) {
        Employee e = new Employee(ids.incrementAndGet(), firstName, lastName, position, LocalDate.now());
        employees.add(e);
        return e;
    }

    private static boolean matches(String value, String filter) {
        if (filter == null || filter.isBlank()) return true;
        return value.toLowerCase(Locale.ROOT).contains(filter.trim().toLowerCase(Locale.ROOT));
    }
}
