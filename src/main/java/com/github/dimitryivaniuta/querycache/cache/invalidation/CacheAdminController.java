package com.github.dimitryivaniuta.querycache.cache.invalidation;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/cache")
public class CacheAdminController {

    private final CacheInvalidationService invalidationService;

    // ---------- DTOs ----------
    public record CacheInvalidationRequest(
            @Size(max = 1024) String key,
            @Size(max = 512) String prefix,
            Boolean invalidateAll
    ) {}

    // ---------- endpoints ----------

    /**
     * Exactly one path runs, in priority order: invalidateAll, key, prefix.
     */
    @PostMapping("/invalidate")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void invalidate(@Valid @RequestBody(required = false) CacheInvalidationRequest req,
                           @RequestParam(required = false) Boolean invalidateAll) {
        CacheInvalidationRequest body = req != null ? req : new CacheInvalidationRequest(null, null, null);

        if (Boolean.TRUE.equals(body.invalidateAll()) || Boolean.TRUE.equals(invalidateAll)) {
            invalidationService.invalidateAll();
            return;
        }

        if (hasText(body.key())) {
            invalidationService.invalidateKey(body.key().trim());
            return;
        }

        if (hasText(body.prefix())) {
            invalidationService.invalidatePrefix(body.prefix().trim());
            return;
        }

        throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Specify a key, prefix, or set invalidateAll=true.");
    }

    private static boolean hasText(String v) {
        return v != null && !v.isBlank();
    }
}
