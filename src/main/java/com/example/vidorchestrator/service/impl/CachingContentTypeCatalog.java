package com.example.vidorchestrator.service.impl;

import com.example.vidorchestrator.service.ContentTypeCatalog;
import com.example.vidorchestrator.service.ContentTypeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
public class CachingContentTypeCatalog implements ContentTypeCatalog {

    private static final Logger log = LoggerFactory.getLogger(CachingContentTypeCatalog.class);

    static final Duration FALLBACK_TTL = Duration.ofMinutes(1);

    private final ContentTypeProvider contentTypeProvider;
    private final Clock clock;
    private final Duration cacheTtl;

    private volatile CachedTypes cached;

    private record CachedTypes(List<String> types, Instant expiresAt) {
    }

    public CachingContentTypeCatalog(ContentTypeProvider contentTypeProvider,
                                     Clock clock,
                                     @Value("${processing.content-types.cache-ttl-minutes:5}") long cacheTtlMinutes) {
        this.contentTypeProvider = contentTypeProvider;
        this.clock = clock;
        this.cacheTtl = Duration.ofMinutes(cacheTtlMinutes);
    }

    @Override
    public List<String> getSupportedContentTypes() {
        Instant now = clock.instant();
        CachedTypes current = cached;
        if (current != null && now.isBefore(current.expiresAt())) {
            return current.types();
        }

        try {
            List<String> loaded = contentTypeProvider.loadContentTypes();
            if (loaded == null || loaded.isEmpty()) {
                log.warn("Content type provider returned no types, using defaults");
                return cache(DEFAULT_CONTENT_TYPES, now.plus(FALLBACK_TTL));
            }
            log.debug("Loaded {} content types", loaded.size());
            return cache(List.copyOf(loaded), now.plus(cacheTtl));
        } catch (RuntimeException e) {
            log.error("Error loading content types, using defaults: {}", e.getMessage(), e);
            return cache(DEFAULT_CONTENT_TYPES, now.plus(FALLBACK_TTL));
        }
    }

    /**
     * Drops the cached list so the next call reloads it.
     */
    public void invalidate() {
        cached = null;
    }

    private List<String> cache(List<String> types, Instant expiresAt) {
        cached = new CachedTypes(types, expiresAt);
        return types;
    }
}
