package com.example.vidorchestrator.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * @param videoId       external video id (e.g. the YouTube id)
 * @param videoRecordId persisted video record to finalize on completion, optional
 * @param contentTypes  content types to generate; omitted means none
 */
public record StartProcessingRequest(
        @NotBlank(message = "videoId is required")
        @Size(max = 64, message = "videoId cannot exceed 64 characters")
        String videoId,

        @Size(max = 64, message = "videoRecordId cannot exceed 64 characters")
        String videoRecordId,

        List<@NotBlank String> contentTypes
) {
}
