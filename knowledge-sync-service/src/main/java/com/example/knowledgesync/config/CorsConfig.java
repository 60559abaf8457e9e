package com.example.knowledgesync.config;

import com.example.knowledgesync.logging.CorrelationIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Lets browser dashboards call /status and /sync directly.
 * Origins come from CORS_ALLOWED_ORIGINS (comma separated, default any origin).
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class CorsConfig implements WebMvcConfigurer {

    private final SyncProperties properties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        List<String> origins = properties.getCors().getAllowedOrigins();
        if (origins.contains("*")) {
            log.warn("CORS allows any origin. Set CORS_ALLOWED_ORIGINS to restrict it.");
        }

        registry.addMapping("/**")
                .allowedOrigins(origins.toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(CorrelationIds.HEADER)
                .maxAge(3600);
    }
}
