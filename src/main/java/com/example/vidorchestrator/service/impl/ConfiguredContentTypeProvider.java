package com.example.vidorchestrator.service.impl;

import com.example.vidorchestrator.service.ContentTypeCatalog;
import com.example.vidorchestrator.service.ContentTypeProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads the content types from {@code processing.content-types}; the built-in list when unset.
 */
@Component
public class ConfiguredContentTypeProvider implements ContentTypeProvider {

    private final List<String> configuredTypes;

    public ConfiguredContentTypeProvider(@Value("${processing.content-types:}") List<String> configuredTypes) {
        this.configuredTypes = configuredTypes == null ? List.of() : configuredTypes.stream()
                .map(String::trim)
                .filter(type -> !type.isEmpty())
                .distinct()
                .toList();
    }

    @Override
    public List<String> loadContentTypes() {
        return configuredTypes.isEmpty() ? ContentTypeCatalog.DEFAULT_CONTENT_TYPES : configuredTypes;
    }
}
