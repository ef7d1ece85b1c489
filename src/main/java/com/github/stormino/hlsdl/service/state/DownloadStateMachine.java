package com.github.stormino.hlsdl.service.state;

import com.github.stormino.hlsdl.model.DownloadStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for a download session's phases.
 * Validates state transitions and prevents invalid state changes.
 *
 * Valid state flow:
 * <pre>
 * PLANNING → RESUMING → DOWNLOADING → MERGING → COMPLETED
 *    ↓          ↓   ↘________________↗    ↓         ↓
 *  FAILED    FAILED      FAILED/CANCELLED      FAILED
 * </pre>
 * RESUMING goes straight to MERGING when every segment is already cached.
 */
@Component
@Slf4j
public class DownloadStateMachine {

    private final Map<DownloadStatus, Set<DownloadStatus>> validTransitions;

    public DownloadStateMachine() {
        validTransitions = new EnumMap<>(DownloadStatus.class);
        initializeTransitions();
    }

    private void initializeTransitions() {
        validTransitions.put(DownloadStatus.PLANNING,
            EnumSet.of(DownloadStatus.RESUMING, DownloadStatus.FAILED, DownloadStatus.CANCELLED));

        validTransitions.put(DownloadStatus.RESUMING,
            EnumSet.of(DownloadStatus.DOWNLOADING, DownloadStatus.MERGING, DownloadStatus.FAILED, DownloadStatus.CANCELLED));

        validTransitions.put(DownloadStatus.DOWNLOADING,
            EnumSet.of(DownloadStatus.MERGING, DownloadStatus.FAILED, DownloadStatus.CANCELLED));

        // Merging is not interruptible: the muxer runs to completion or fails
        validTransitions.put(DownloadStatus.MERGING,
            EnumSet.of(DownloadStatus.COMPLETED, DownloadStatus.FAILED));

        validTransitions.put(DownloadStatus.COMPLETED, EnumSet.noneOf(DownloadStatus.class));
        validTransitions.put(DownloadStatus.FAILED, EnumSet.noneOf(DownloadStatus.class));
        validTransitions.put(DownloadStatus.CANCELLED, EnumSet.noneOf(DownloadStatus.class));
    }

    /**
     * Check if a state transition is valid.
     *
     * @param currentState Current state
     * @param newState Desired new state
     * @return true if transition is valid
     */
    public boolean isValidTransition(@NonNull DownloadStatus currentState, @NonNull DownloadStatus newState) {
        if (currentState == newState) {
            // Same state is always valid (idempotent)
            return true;
        }

        Set<DownloadStatus> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    /**
     * Validate and perform state transition with exception on failure.
     *
     * @param sessionId Session identifier for logging
     * @param currentState Current state
     * @param newState Desired new state
     * @return New state
     * @throws IllegalStateException if transition is invalid
     */
    public DownloadStatus transitionOrThrow(
            @NonNull String sessionId,
            @NonNull DownloadStatus currentState,
            @NonNull DownloadStatus newState) {

        if (!isValidTransition(currentState, newState)) {
            throw new IllegalStateException(String.format(
                    "Invalid state transition for session %s: %s → %s",
                    sessionId, currentState, newState));
        }

        if (currentState != newState) {
            log.debug("Session {} state transition: {} → {}", sessionId, currentState, newState);
        }
        return newState;
    }

    /**
     * Check if a state is terminal (no further transitions possible).
     *
     * @param state State to check
     * @return true if terminal state
     */
    public boolean isTerminalState(@NonNull DownloadStatus state) {
        Set<DownloadStatus> allowedTransitions = validTransitions.get(state);
        return allowedTransitions == null || allowedTransitions.isEmpty();
    }

    /**
     * Get all valid next states from current state.
     *
     * @param currentState Current state
     * @return Set of valid next states
     */
    public Set<DownloadStatus> getValidNextStates(@NonNull DownloadStatus currentState) {
        Set<DownloadStatus> states = validTransitions.get(currentState);
        return states != null ? EnumSet.copyOf(states) : EnumSet.noneOf(DownloadStatus.class);
    }

    /**
     * Check if current state can be cancelled.
     *
     * @param currentState Current state
     * @return true if can transition to CANCELLED
     */
    public boolean canCancel(@NonNull DownloadStatus currentState) {
        return isValidTransition(currentState, DownloadStatus.CANCELLED);
    }
}
