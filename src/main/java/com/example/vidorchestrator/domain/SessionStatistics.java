package com.example.vidorchestrator.domain;

public record SessionStatistics(
        int totalVideos,
        int completedVideos,
        int processingVideos,
        int failedContentItems
) {
}
