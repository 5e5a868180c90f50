package com.github.dimitryivaniuta.querycache.config;

import java.util.List;

import com.github.dimitryivaniuta.querycache.cache.CachingProperties;
import com.github.dimitryivaniuta.querycache.web.RequestContextKeys;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
public class CorsConfig {

    @Bean
    CorsConfigurationSource corsConfigurationSource(CachingProperties caching) {
        CorsConfiguration c = new CorsConfiguration();
        c.setAllowedOrigins(List.of("http://localhost:3000"));
        c.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        c.setAllowedHeaders(List.of(
                "Content-Type",
                "Authorization",
                RequestContextKeys.CORRELATION_ID_HEADER,
                caching.getBypass().getHeaderName()
        ));
        // diagnostics headers must be readable from browser clients
        c.setExposedHeaders(List.of(
                RequestContextKeys.CORRELATION_ID_HEADER,
                caching.getDiagnostics().getHeaderName(),
                RequestContextKeys.CACHE_KEY_HEADER,
                RequestContextKeys.CACHE_DURATION_HEADER
        ));
        c.setAllowCredentials(false);
        c.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource src = new UrlBasedCorsConfigurationSource();
        src.registerCorsConfiguration("/**", c);
        return src;
    }
}
