package com.example.knowledgesync.service;

import com.example.knowledgesync.config.SyncProperties;
import com.example.knowledgesync.exception.SyncConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fail-fast check of the settings every run needs.
 * Reports all offending settings at once, named by their environment variables.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfigValidator {

    private final SyncProperties properties;

    /**
     * @throws SyncConfigurationException if any required setting is missing or a placeholder
     */
    public void validate() {
        Map<String, String> required = new LinkedHashMap<>();
        required.put("ATLASSIAN_URL", properties.getAtlassian().getUrl());
        required.put("ATLASSIAN_EMAIL", properties.getAtlassian().getEmail());
        required.put("ATLASSIAN_API_TOKEN", properties.getAtlassian().getApiToken());
        required.put("DIFY_API_KEY", properties.getDify().getApiKey());
        required.put("DIFY_API_URL", properties.getDify().getApiUrl());
        required.put("DIFY_DATASET_ID", properties.getDify().getDatasetId());

        List<String> missing = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();

        required.forEach((name, value) -> {
            if (value == null || value.isBlank()) {
                missing.add(name);
            } else if (properties.getValidation().isPlaceholder(value)) {
                placeholders.add(name);
            }
        });

        if (missing.isEmpty() && placeholders.isEmpty()) {
            log.info("Configuration validated");
            return;
        }

        List<String> problems = new ArrayList<>();
        if (!missing.isEmpty()) {
            problems.add("missing required settings: " + String.join(", ", missing));
        }
        if (!placeholders.isEmpty()) {
            problems.add("settings still hold template values: " + String.join(", ", placeholders));
        }
        throw new SyncConfigurationException(String.join("; ", problems), missing, placeholders);
    }
}
