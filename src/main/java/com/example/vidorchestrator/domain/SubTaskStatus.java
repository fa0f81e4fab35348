package com.example.vidorchestrator.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Locale;

/**
 * Status of one unit of work inside a {@link ProcessingSession}: the transcript
 * extraction or a single content type.
 * Not thread-safe; guarded by the owning session's monitor.
 * <p>
 * {@code status}, {@code completedAt} and {@code error} are always serialized; the
 * failure diagnostics only when set.
 */
public class SubTaskStatus {

    public enum State {
        PENDING,
        COMPLETED,
        FAILED,
        SKIPPED,
        CANCELLED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public boolean isTerminal() {
            return this != PENDING;
        }

        public static State fromValue(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Status value cannot be blank");
            }
            return State.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private State status;
    private Instant completedAt;
    private String error;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String errorCode;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String errorType;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean isFiltered;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String suggestedFix;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String failureReason;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String providerUsed;

    public SubTaskStatus(State status) {
        this.status = status;
    }

    /**
     * Applies a new state. {@code completedAt} is stamped for terminal states and
     * cleared for {@link State#PENDING}; failure metadata is replaced, never merged.
     */
    public void apply(State newStatus, String error, SubTaskMetadata metadata, Instant now) {
        this.status = newStatus;
        this.completedAt = newStatus.isTerminal() ? now : null;
        this.error = error;
        SubTaskMetadata details = metadata != null ? metadata : SubTaskMetadata.EMPTY;
        this.errorCode = details.errorCode();
        this.errorType = details.errorType();
        this.isFiltered = details.isFiltered();
        this.suggestedFix = details.suggestedFix();
        this.failureReason = details.failureReason();
        this.providerUsed = details.providerUsed();
    }

    public SubTaskStatus copy() {
        SubTaskStatus copy = new SubTaskStatus(status);
        copy.completedAt = completedAt;
        copy.error = error;
        copy.errorCode = errorCode;
        copy.errorType = errorType;
        copy.isFiltered = isFiltered;
        copy.suggestedFix = suggestedFix;
        copy.failureReason = failureReason;
        copy.providerUsed = providerUsed;
        return copy;
    }

    public State getStatus() {
        return status;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getError() {
        return error;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorType() {
        return errorType;
    }

    public Boolean getIsFiltered() {
        return isFiltered;
    }

    public String getSuggestedFix() {
        return suggestedFix;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public String getProviderUsed() {
        return providerUsed;
    }
}
