package com.example.vidorchestrator.service;

import com.example.vidorchestrator.domain.ProcessingSession;
import com.example.vidorchestrator.domain.SessionStatistics;
import com.example.vidorchestrator.domain.SubTaskMetadata;
import com.example.vidorchestrator.domain.SubTaskStatus;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Tracks one {@link ProcessingSession} per in-flight video: the transcript plus every
 * supported content type. Detects overall completion, supports cooperative cancellation and
 * publishes a status event after each mutation.
 * <p>
 * All returned sessions are detached snapshots.
 */
public interface StatusTracker {

    /**
     * Starts tracking a video. Supported content types that were not requested are marked
     * skipped immediately. Re-initializing a tracked video replaces the previous session.
     *
     * @param videoId                  External video identifier.
     * @param userId                   Owner of the session.
     * @param videoRecordId            Internal storage key of the video record.
     * @param requestedContentTypes    Content types to generate.
     * @param allSupportedContentTypes Every content type the system knows about.
     * @return Snapshot of the new session.
     * @throws com.example.vidorchestrator.exceptions.ProcessingValidationException if a required argument is missing.
     */
    ProcessingSession initialize(String videoId, String userId, String videoRecordId,
                                 Collection<String> requestedContentTypes,
                                 Collection<String> allSupportedContentTypes);

    /**
     * Sets the transcript status. Unknown videos are logged and ignored.
     *
     * @param videoId The video ID.
     * @param status  The new status.
     * @param error   Error message, may be null.
     */
    void updateTranscriptStatus(String videoId, SubTaskStatus.State status, String error);

    /**
     * Sets the status of one content type. Unknown videos or content types are logged and ignored.
     *
     * @param videoId     The video ID.
     * @param contentType The content type.
     * @param status      The new status.
     * @param error       Error message, may be null.
     * @param metadata    Failure diagnostics, may be null.
     */
    void updateContentStatus(String videoId, String contentType, SubTaskStatus.State status,
                             String error, SubTaskMetadata metadata);

    /**
     * Forces every pending entry to cancelled and schedules removal after the grace period.
     *
     * @param videoId The video ID.
     * @return false if the video was not tracked.
     */
    boolean cancel(String videoId);

    Optional<ProcessingSession> getVideoStatus(String videoId);

    /**
     * Sessions of a user that are in flight or completed within the recent window,
     * newest start first.
     */
    List<ProcessingSession> getUserSessions(String userId);

    /**
     * Visits the same sessions as {@link #getUserSessions(String)}, in the same order,
     * invoking {@code action} with a snapshot while the live session is locked. Status
     * events for a session cannot be published while its action runs, so anything the
     * action delivers precedes every later update of that session.
     * <p>
     * The action must not call back into mutating tracker operations for the same video.
     */
    void forEachUserSession(String userId, Consumer<ProcessingSession> action);

    /**
     * Removes the user's completed sessions; in-flight sessions are kept.
     *
     * @return number of sessions removed.
     */
    int clearCompletedForUser(String userId);

    /**
     * Removes every session of the user, including in-flight ones. Late task callbacks
     * for those videos are dropped.
     *
     * @return number of sessions removed.
     */
    int forceClearForUser(String userId);

    SessionStatistics getStatistics();

    /**
     * Removes sessions whose last update is older than {@code maxAge}.
     *
     * @return number of sessions removed.
     */
    int purgeStale(Duration maxAge);
}
