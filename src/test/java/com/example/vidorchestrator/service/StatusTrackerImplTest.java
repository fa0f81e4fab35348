package com.example.vidorchestrator.service;

import com.example.vidorchestrator.MutableClock;
import com.example.vidorchestrator.domain.ProcessingSession;
import com.example.vidorchestrator.domain.SessionStatistics;
import com.example.vidorchestrator.domain.SubTaskMetadata;
import com.example.vidorchestrator.domain.SubTaskStatus.State;
import com.example.vidorchestrator.events.ProcessingCompletedEvent;
import com.example.vidorchestrator.events.ProcessingStatusChangedEvent;
import com.example.vidorchestrator.exceptions.ProcessingValidationException;
import com.example.vidorchestrator.service.impl.StatusTrackerImpl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StatusTrackerImpl Unit Tests")
class StatusTrackerImplTest {

    private static final Instant START = Instant.parse("2025-05-01T10:00:00Z");
    private static final List<String> SUPPORTED = List.of("summary_text", "quiz_text", "chapters_text");

    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private TaskScheduler taskScheduler;
    @Mock
    private ScheduledFuture<Object> scheduledFuture;

    @Captor
    private ArgumentCaptor<Runnable> runnableCaptor;
    @Captor
    private ArgumentCaptor<Instant> instantCaptor;

    private MutableClock clock;
    private StatusTrackerImpl statusTracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        statusTracker = new StatusTrackerImpl(eventPublisher, taskScheduler, clock, 30, 5000, 5);
        lenient().doReturn(scheduledFuture).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    private List<ApplicationEvent> publishedEvents() {
        ArgumentCaptor<ApplicationEvent> eventCaptor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(eventPublisher, atLeast(0)).publishEvent(eventCaptor.capture());
        return eventCaptor.getAllValues();
    }

    private List<ProcessingStatusChangedEvent> statusEvents() {
        return publishedEvents().stream()
                .filter(ProcessingStatusChangedEvent.class::isInstance)
                .map(ProcessingStatusChangedEvent.class::cast)
                .toList();
    }

    private long completedEventCount() {
        return publishedEvents().stream().filter(ProcessingCompletedEvent.class::isInstance).count();
    }

    private ProcessingSession status(String videoId) {
        return statusTracker.getVideoStatus(videoId).orElseThrow();
    }

    @Nested
    @DisplayName("initialize Tests")
    class InitializeTests {

        @Test
        @DisplayName("✅ Unrequested types start skipped, requested and transcript pending")
        void initialize_MarksUnrequestedTypesSkipped() {
            ProcessingSession session = statusTracker.initialize("v1", "u1", "rec-1",
                    List.of("summary_text"), SUPPORTED);

            assertThat(session.getTranscript().getStatus()).isEqualTo(State.PENDING);
            assertThat(session.getContentStatus("summary_text").getStatus()).isEqualTo(State.PENDING);
            assertThat(session.getContentStatus("quiz_text").getStatus()).isEqualTo(State.SKIPPED);
            assertThat(session.getContentStatus("chapters_text").getStatus()).isEqualTo(State.SKIPPED);
            assertThat(session.isCompleted()).isFalse();
            assertThat(session.getStartTime()).isEqualTo(START);
        }

        @Test
        @DisplayName("✅ Pushes the fresh snapshot once")
        void initialize_PublishesOneStatusEvent() {
            statusTracker.initialize("v1", "u1", "rec-1", List.of("summary_text"), SUPPORTED);

            List<ProcessingStatusChangedEvent> events = statusEvents();
            assertThat(events).hasSize(1);
            assertThat(events.get(0).getUserId()).isEqualTo("u1");
            assertThat(events.get(0).getVideoId()).isEqualTo("v1");
        }

        @Test
        @DisplayName("✅ Nothing requested: still waits for the transcript")
        void initialize_NothingRequested_NotCompleted() {
            ProcessingSession session = statusTracker.initialize("v1", "u1", null, List.of(), SUPPORTED);

            assertThat(session.isCompleted()).isFalse();
            assertThat(session.getContent().values()).allMatch(s -> s.getStatus() == State.SKIPPED);
        }

        @Test
        @DisplayName("❌ Should reject missing userId")
        void initialize_MissingUserId_Throws() {
            assertThatThrownBy(() -> statusTracker.initialize("v1", " ", null, List.of(), SUPPORTED))
                    .isInstanceOf(ProcessingValidationException.class)
                    .hasMessageContaining("userId is required");
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("❌ Should reject missing videoId")
        void initialize_MissingVideoId_Throws() {
            assertThatThrownBy(() -> statusTracker.initialize(null, "u1", null, List.of(), SUPPORTED))
                    .isInstanceOf(ProcessingValidationException.class);
        }

        @Test
        @DisplayName("✅ Re-initialize cancels the previous timer and the stale timer removes nothing")
        void initialize_Twice_ReplacesSessionAndCancelsTimer() {
            statusTracker.initialize("v1", "u1", null, List.of(), SUPPORTED);
            statusTracker.cancel("v1");
            verify(taskScheduler).schedule(runnableCaptor.capture(), any(Instant.class));
            Runnable staleRemoval = runnableCaptor.getValue();

            statusTracker.initialize("v1", "u1", null, List.of("quiz_text"), SUPPORTED);
            verify(scheduledFuture).cancel(false);

            staleRemoval.run();

            ProcessingSession current = status("v1");
            assertThat(current.isCancelled()).isFalse();
            assertThat(current.getContentStatus("quiz_text").getStatus()).isEqualTo(State.PENDING);
        }
    }

    @Nested
    @DisplayName("Completion Tests")
    class CompletionTests {

        @Test
        @DisplayName("✅ Completes once transcript and every requested type are terminal")
        void updates_CompleteSession() {
            statusTracker.initialize("v1", "u1", "rec-1", List.of("summary_text"), SUPPORTED);

            statusTracker.updateTranscriptStatus("v1", State.COMPLETED, null);
            assertThat(status("v1").isCompleted()).isFalse();

            clock.advance(Duration.ofSeconds(10));
            statusTracker.updateContentStatus("v1", "summary_text", State.COMPLETED, null, null);

            ProcessingSession session = status("v1");
            assertThat(session.isCompleted()).isTrue();
            assertThat(session.isCancelled()).isFalse();
            assertThat(session.getCompletedAt()).isEqualTo(START.plusSeconds(10));
            assertThat(completedEventCount()).isEqualTo(1);
            assertThat(statusEvents()).hasSize(3);
            assertThat(statusEvents().get(2).getSnapshot().isCompleted()).isTrue();
        }

        @Test
        @DisplayName("✅ Completion arms the 30 minute removal timer")
        void completion_SchedulesTtlRemoval() {
            statusTracker.initialize("v1", "u1", null, List.of(), SUPPORTED);
            statusTracker.updateTranscriptStatus("v1", State.COMPLETED, null);

            verify(taskScheduler).schedule(runnableCaptor.capture(), instantCaptor.capture());
            assertThat(instantCaptor.getValue()).isEqualTo(START.plus(Duration.ofMinutes(30)));

            runnableCaptor.getValue().run();
            assertThat(statusTracker.getVideoStatus("v1")).isEmpty();
        }

        @Test
        @DisplayName("✅ Failed content still counts as terminal, metadata is kept")
        void failedContent_IsTerminalWithMetadata() {
            statusTracker.initialize("v1", "u1", null, List.of("summary_text"), SUPPORTED);
            statusTracker.updateTranscriptStatus("v1", State.COMPLETED, null);

            SubTaskMetadata metadata = new SubTaskMetadata("CONTENT_FILTERED", "safety", true,
                    "Try a different prompt", "Blocked by provider", "gemini");
            statusTracker.updateContentStatus("v1", "summary_text", State.FAILED, "Blocked", metadata);

            ProcessingSession session = status("v1");
            assertThat(session.isCompleted()).isTrue();
            assertThat(session.getContentStatus("summary_text").getError()).isEqualTo("Blocked");
            assertThat(session.getContentStatus("summary_text").getErrorCode()).isEqualTo("CONTENT_FILTERED");
            assertThat(session.getContentStatus("summary_text").getIsFiltered()).isTrue();
            assertThat(session.getContentStatus("summary_text").getProviderUsed()).isEqualTo("gemini");
        }

        @Test
        @DisplayName("✅ Updates after completion are ignored and push nothing")
        void updateAfterCompletion_Ignored() {
            statusTracker.initialize("v1", "u1", null, List.of("summary_text"), SUPPORTED);
            statusTracker.updateTranscriptStatus("v1", State.COMPLETED, null);
            statusTracker.updateContentStatus("v1", "summary_text", State.COMPLETED, null, null);
            int pushesBefore = statusEvents().size();

            statusTracker.updateContentStatus("v1", "summary_text", State.PENDING, null, null);
            statusTracker.updateTranscriptStatus("v1", State.FAILED, "late");

            ProcessingSession session = status("v1");
            assertThat(session.isCompleted()).isTrue();
            assertThat(session.getTranscript().getStatus()).isEqualTo(State.COMPLETED);
            assertThat(session.getContentStatus("summary_text").getStatus()).isEqualTo(State.COMPLETED);
            assertThat(statusEvents()).hasSize(pushesBefore);
            assertThat(completedEventCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("✅ Skipped types never transition")
        void updateSkippedType_Ignored() {
            statusTracker.initialize("v1", "u1", null, List.of("summary_text"), SUPPORTED);

            statusTracker.updateContentStatus("v1", "quiz_text", State.COMPLETED, null, null);

            assertThat(status("v1").getContentStatus("quiz_text").getStatus()).isEqualTo(State.SKIPPED);
            assertThat(statusEvents()).hasSize(1);
        }

        @Test
        @DisplayName("✅ Unknown video or content type is absorbed")
        void updateUnknown_NoException() {
            statusTracker.initialize("v1", "u1", null, List.of("summary_text"), SUPPORTED);

            statusTracker.updateTranscriptStatus("missing", State.COMPLETED, null);
            statusTracker.updateContentStatus("v1", "ebook_text", State.COMPLETED, null, null);

            assertThat(statusEvents()).hasSize(1);
            assertThat(status("v1").getContent()).doesNotContainKey("ebook_text");
        }
    }

    @Nested
    @DisplayName("Concurrent Completion Tests")
    class ConcurrentCompletionTests {

        private static final int ROUNDS = 200;

        private final ExecutorService executor = Executors.newFixedThreadPool(2);

        @AfterEach
        void tearDown() {
            executor.shutdownNow();
        }

        @Test
        @DisplayName("✅ Transcript and last content finishing together complete the session exactly once")
        void lastTwoUpdatesRacing_CompleteOnce() throws Exception {
            for (int round = 0; round < ROUNDS; round++) {
                String videoId = "race-" + round;
                statusTracker.initialize(videoId, "u1", null, List.of("summary_text", "quiz_text"), SUPPORTED);
                statusTracker.updateContentStatus(videoId, "quiz_text", State.COMPLETED, null, null);

                CountDownLatch startGate = new CountDownLatch(1);
                Future<?> transcript = executor.submit(() -> {
                    startGate.await();
                    statusTracker.updateTranscriptStatus(videoId, State.COMPLETED, null);
                    return null;
                });
                Future<?> content = executor.submit(() -> {
                    startGate.await();
                    statusTracker.updateContentStatus(videoId, "summary_text", State.COMPLETED, null, null);
                    return null;
                });
                startGate.countDown();
                transcript.get(5, TimeUnit.SECONDS);
                content.get(5, TimeUnit.SECONDS);

                ProcessingSession session = status(videoId);
                assertThat(session.isCompleted()).as(videoId).isTrue();
                assertThat(session.getTranscript().getStatus()).isEqualTo(State.COMPLETED);
                assertThat(session.getContentStatus("summary_text").getStatus()).isEqualTo(State.COMPLETED);
            }

            Map<String, Long> completionsPerVideo = publishedEvents().stream()
                    .filter(ProcessingCompletedEvent.class::isInstance)
                    .map(ProcessingCompletedEvent.class::cast)
                    .collect(Collectors.groupingBy(ProcessingCompletedEvent::getVideoId, Collectors.counting()));
            assertThat(completionsPerVideo).hasSize(ROUNDS).allSatisfy((videoId, count) -> assertThat(count).isEqualTo(1L));
            verify(taskScheduler, times(ROUNDS)).schedule(any(Runnable.class), any(Instant.class));
        }
    }

    @Nested
    @DisplayName("cancel Tests")
    class CancelTests {

        @Test
        @DisplayName("✅ Cancels pending entries, keeps finished ones and arms the grace timer")
        void cancel_PendingEntriesCancelled() {
            statusTracker.initialize("v1", "u1", null, List.of("summary_text", "quiz_text"), SUPPORTED);
            statusTracker.updateTranscriptStatus("v1", State.COMPLETED, null);
            statusTracker.updateContentStatus("v1", "summary_text", State.COMPLETED, null, null);

            boolean cancelled = statusTracker.cancel("v1");

            assertThat(cancelled).isTrue();
            ProcessingSession session = status("v1");
            assertThat(session.isCancelled()).isTrue();
            assertThat(session.isCompleted()).isTrue();
            assertThat(session.getContentStatus("summary_text").getStatus()).isEqualTo(State.COMPLETED);
            assertThat(session.getContentStatus("quiz_text").getStatus()).isEqualTo(State.CANCELLED);
            assertThat(session.getContentStatus("chapters_text").getStatus()).isEqualTo(State.SKIPPED);

            verify(taskScheduler).schedule(runnableCaptor.capture(), instantCaptor.capture());
            assertThat(instantCaptor.getValue()).isEqualTo(START.plusMillis(5000));
            assertThat(completedEventCount()).isZero();
        }

        @Test
        @DisplayName("✅ Grace timer removes the session; later updates are dropped")
        void cancel_GraceTimerRemovesSession() {
            statusTracker.initialize("v1", "u1", null, List.of("summary_text"), SUPPORTED);
            statusTracker.cancel("v1");
            verify(taskScheduler).schedule(runnableCaptor.capture(), any(Instant.class));

            runnableCaptor.getValue().run();

            assertThat(statusTracker.getVideoStatus("v1")).isEmpty();
            statusTracker.updateContentStatus("v1", "summary_text", State.COMPLETED, null, null);
            assertThat(statusTracker.getVideoStatus("v1")).isEmpty();
        }

        @Test
        @DisplayName("✅ Late task result after cancel does not change the snapshot")
        void cancel_LateResultIgnored() {
            statusTracker.initialize("v1", "u1", null, List.of("summary_text"), SUPPORTED);
            statusTracker.cancel("v1");

            statusTracker.updateTranscriptStatus("v1", State.COMPLETED, null);

            assertThat(status("v1").getTranscript().getStatus()).isEqualTo(State.CANCELLED);
        }

        @Test
        @DisplayName("❌ Unknown video returns false")
        void cancel_Unknown_ReturnsFalse() {
            assertThat(statusTracker.cancel("nope")).isFalse();
            verifyNoInteractions(taskScheduler);
        }
    }

    @Nested
    @DisplayName("Session Query Tests")
    class QueryTests {

        @Test
        @DisplayName("✅ getUserSessions returns in-flight and recently completed, newest first")
        void getUserSessions_FiltersAndSorts() {
            statusTracker.initialize("old", "u1", null, List.of(), SUPPORTED);
            statusTracker.updateTranscriptStatus("old", State.COMPLETED, null);

            clock.advance(Duration.ofMinutes(1));
            statusTracker.initialize("recent", "u1", null, List.of(), SUPPORTED);

            clock.advance(Duration.ofMinutes(1));
            statusTracker.initialize("running", "u1", null, List.of("summary_text"), SUPPORTED);
            statusTracker.initialize("other", "u2", null, List.of(), SUPPORTED);

            clock.advance(Duration.ofMinutes(4));
            statusTracker.updateTranscriptStatus("recent", State.COMPLETED, null);

            List<ProcessingSession> sessions = statusTracker.getUserSessions("u1");

            // "old" completed 6 minutes ago, outside the 5 minute window
            assertThat(sessions).extracting(ProcessingSession::getVideoId).containsExactly("running", "recent");
        }

        @Test
        @DisplayName("✅ forEachUserSession visits the same sessions as getUserSessions, in order")
        void forEachUserSession_MatchesUserSessions() {
            statusTracker.initialize("first", "u1", null, List.of("summary_text"), SUPPORTED);
            clock.advance(Duration.ofMinutes(1));
            statusTracker.initialize("second", "u1", null, List.of(), SUPPORTED);
            statusTracker.updateTranscriptStatus("second", State.COMPLETED, null);
            statusTracker.initialize("foreign", "u2", null, List.of(), SUPPORTED);

            List<String> visited = new ArrayList<>();
            statusTracker.forEachUserSession("u1", session -> visited.add(session.getVideoId()));

            assertThat(visited).containsExactly("second", "first");
            assertThat(statusTracker.getUserSessions("u1")).extracting(ProcessingSession::getVideoId)
                    .containsExactlyElementsOf(visited);
        }

        @Test
        @DisplayName("✅ Updates to a visited session wait until its action returns")
        void forEachUserSession_HoldsSessionWhileVisiting() throws Exception {
            statusTracker.initialize("v1", "u1", null, List.of("summary_text"), SUPPORTED);
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                List<Future<?>> updates = new ArrayList<>();
                statusTracker.forEachUserSession("u1", session -> {
                    Future<?> update = executor.submit(() ->
                            statusTracker.updateTranscriptStatus("v1", State.COMPLETED, null));
                    updates.add(update);
                    assertThatThrownBy(() -> update.get(200, TimeUnit.MILLISECONDS))
                            .isInstanceOf(TimeoutException.class);
                    assertThat(session.getTranscript().getStatus()).isEqualTo(State.PENDING);
                });

                updates.get(0).get(5, TimeUnit.SECONDS);
                assertThat(status("v1").getTranscript().getStatus()).isEqualTo(State.COMPLETED);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("✅ Snapshots are copies")
        void getVideoStatus_ReturnsCopy() {
            statusTracker.initialize("v1", "u1", null, List.of("summary_text"), SUPPORTED);
            ProcessingSession snapshot = status("v1");

            statusTracker.updateTranscriptStatus("v1", State.COMPLETED, null);

            assertThat(snapshot.getTranscript().getStatus()).isEqualTo(State.PENDING);
        }

        @Test
        @DisplayName("✅ clearCompletedForUser keeps in-flight and other users' sessions")
        void clearCompleted_OnlyCompletedOfUser() {
            statusTracker.initialize("done", "u1", null, List.of(), SUPPORTED);
            statusTracker.updateTranscriptStatus("done", State.COMPLETED, null);
            statusTracker.initialize("running", "u1", null, List.of("summary_text"), SUPPORTED);
            statusTracker.initialize("foreign", "u2", null, List.of(), SUPPORTED);
            statusTracker.updateTranscriptStatus("foreign", State.COMPLETED, null);

            int cleared = statusTracker.clearCompletedForUser("u1");

            assertThat(cleared).isEqualTo(1);
            assertThat(statusTracker.getVideoStatus("done")).isEmpty();
            assertThat(statusTracker.getVideoStatus("running")).isPresent();
            assertThat(statusTracker.getVideoStatus("foreign")).isPresent();
            then(scheduledFuture).should(atLeastOnce()).cancel(false);
        }

        @Test
        @DisplayName("✅ forceClearForUser removes in-flight sessions too")
        void forceClear_RemovesAll() {
            statusTracker.initialize("a", "u1", null, List.of("summary_text"), SUPPORTED);
            statusTracker.initialize("b", "u1", null, List.of(), SUPPORTED);

            assertThat(statusTracker.forceClearForUser("u1")).isEqualTo(2);
            assertThat(statusTracker.getUserSessions("u1")).isEmpty();
        }

        @Test
        @DisplayName("✅ getStatistics counts sessions and failed content")
        void getStatistics_Counts() {
            statusTracker.initialize("a", "u1", null, List.of("summary_text", "quiz_text"), SUPPORTED);
            statusTracker.updateTranscriptStatus("a", State.COMPLETED, null);
            statusTracker.updateContentStatus("a", "summary_text", State.FAILED, "boom", null);
            statusTracker.initialize("b", "u2", null, List.of(), SUPPORTED);
            statusTracker.updateTranscriptStatus("b", State.COMPLETED, null);

            SessionStatistics statistics = statusTracker.getStatistics();

            assertThat(statistics).isEqualTo(new SessionStatistics(2, 1, 1, 1));
        }

        @Test
        @DisplayName("✅ purgeStale removes sessions without recent updates")
        void purgeStale_RemovesOld() {
            statusTracker.initialize("stale", "u1", null, List.of("summary_text"), SUPPORTED);
            clock.advance(Duration.ofHours(3));
            statusTracker.initialize("fresh", "u1", null, List.of("summary_text"), SUPPORTED);

            int purged = statusTracker.purgeStale(Duration.ofHours(2));

            assertThat(purged).isEqualTo(1);
            assertThat(statusTracker.getVideoStatus("stale")).isEmpty();
            assertThat(statusTracker.getVideoStatus("fresh")).isPresent();
        }
    }
}
