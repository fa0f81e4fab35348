package com.example.vidorchestrator.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record EnqueueTaskRequest(
        @NotBlank(message = "videoId is required")
        @Size(max = 64, message = "videoId cannot exceed 64 characters")
        String videoId,

        @NotBlank(message = "taskType is required")
        @Size(max = 64, message = "taskType cannot exceed 64 characters")
        String taskType,

        Integer priority, // null picks the default for the task type

        Map<String, String> payload
) {
}
