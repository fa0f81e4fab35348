package com.example.vidorchestrator.service;

import java.util.List;

/**
 * Supplies the content types every new session is initialized with.
 */
public interface ContentTypeCatalog {

    List<String> DEFAULT_CONTENT_TYPES = List.of(
            "summary_text",
            "study_guide_text",
            "discussion_guide_text",
            "group_guide_text",
            "social_media_text",
            "quiz_text",
            "chapters_text",
            "ebook_text"
    );

    /**
     * Returns the supported content types, served from a short-lived cache.
     * Falls back to {@link #DEFAULT_CONTENT_TYPES} if the source cannot be read.
     */
    List<String> getSupportedContentTypes();
}
