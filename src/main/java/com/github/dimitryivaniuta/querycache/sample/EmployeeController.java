package com.github.dimitryivaniuta.querycache.sample;

import com.github.dimitryivaniuta.querycache.sample.dto.Employee;
import com.github.dimitryivaniuta.querycache.sample.dto.EmployeePage;
import com.github.dimitryivaniuta.querycache.sample.dto.EmployeeQuery;
import com.github.dimitryivaniuta.querycache.sample.dto.HireEmployeeRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/employees")
public class EmployeeController {

    private final EmployeeDirectoryService directory;

    @GetMapping
    public EmployeePage search(@RequestParam(defaultValue = "1") @Min(1) int page,
                               @RequestParam(defaultValue = "10") @Min(1) @Max(100) int size,
                               @RequestParam(required = false) String lastName,
                               @RequestParam(required = false) String position) {
        return directory.search(new EmployeeQuery(page, size, lastName, position));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Employee hire(@Valid @RequestBody HireEmployeeRequest req) {
        return directory.hire(req);
    }
}
