package com.github.stormino.hlsdl.service.state;

import com.github.stormino.hlsdl.model.DownloadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadStateMachine")
class DownloadStateMachineTest {

    private DownloadStateMachine stateMachine;
    private static final String SESSION_ID = "2931fa44542f601d";

    @BeforeEach
    void setUp() {
        stateMachine = new DownloadStateMachine();
    }

    @Nested
    @DisplayName("isValidTransition")
    class IsValidTransitionTests {

        @Test
        @DisplayName("same state should always be valid (idempotent)")
        void sameStateShouldAlwaysBeValid() {
            for (DownloadStatus status : DownloadStatus.values()) {
                assertTrue(stateMachine.isValidTransition(status, status),
                        "Same state transition should be valid for " + status);
            }
        }

        @ParameterizedTest
        @CsvSource({
            "PLANNING, RESUMING",
            "PLANNING, FAILED",
            "RESUMING, DOWNLOADING",
            "RESUMING, MERGING",
            "RESUMING, FAILED",
            "DOWNLOADING, MERGING",
            "DOWNLOADING, FAILED",
            "DOWNLOADING, CANCELLED",
            "MERGING, COMPLETED",
            "MERGING, FAILED"
        })
        @DisplayName("should allow session flow")
        void shouldAllowSessionFlow(DownloadStatus from, DownloadStatus to) {
            assertTrue(stateMachine.isValidTransition(from, to));
        }

        @ParameterizedTest
        @CsvSource({
            "PLANNING, DOWNLOADING",
            "PLANNING, MERGING",
            "RESUMING, COMPLETED",
            "DOWNLOADING, COMPLETED",
            "MERGING, CANCELLED",
            "MERGING, DOWNLOADING"
        })
        @DisplayName("should reject skipped or backward steps")
        void shouldRejectSkippedSteps(DownloadStatus from, DownloadStatus to) {
            assertFalse(stateMachine.isValidTransition(from, to));
        }

        @ParameterizedTest
        @EnumSource(value = DownloadStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
        @DisplayName("terminal states should not transition")
        void terminalStatesShouldNotTransition(DownloadStatus terminal) {
            for (DownloadStatus target : DownloadStatus.values()) {
                if (target != terminal) {
                    assertFalse(stateMachine.isValidTransition(terminal, target),
                            terminal + " should not transition to " + target);
                }
            }
        }
    }

    @Nested
    @DisplayName("transitionOrThrow")
    class TransitionOrThrowTests {

        @Test
        @DisplayName("should return new state on valid transition")
        void shouldReturnNewState() {
            assertEquals(DownloadStatus.RESUMING,
                    stateMachine.transitionOrThrow(SESSION_ID, DownloadStatus.PLANNING, DownloadStatus.RESUMING));
        }

        @Test
        @DisplayName("should throw on invalid transition")
        void shouldThrowOnInvalidTransition() {
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> stateMachine.transitionOrThrow(SESSION_ID, DownloadStatus.COMPLETED, DownloadStatus.DOWNLOADING));

            assertTrue(ex.getMessage().contains(SESSION_ID));
        }
    }

    @Nested
    @DisplayName("queries")
    class QueryTests {

        @ParameterizedTest
        @EnumSource(DownloadStatus.class)
        @DisplayName("isTerminalState should agree with status")
        void isTerminalStateShouldAgreeWithStatus(DownloadStatus status) {
            assertEquals(status.isTerminal(), stateMachine.isTerminalState(status));
        }

        @Test
        @DisplayName("resuming can skip to merging")
        void resumingCanSkipToMerging() {
            Set<DownloadStatus> next = stateMachine.getValidNextStates(DownloadStatus.RESUMING);

            assertEquals(Set.of(DownloadStatus.DOWNLOADING, DownloadStatus.MERGING,
                    DownloadStatus.FAILED, DownloadStatus.CANCELLED), next);
        }

        @Test
        @DisplayName("merging cannot be cancelled")
        void mergingCannotBeCancelled() {
            assertTrue(stateMachine.canCancel(DownloadStatus.DOWNLOADING));
            assertFalse(stateMachine.canCancel(DownloadStatus.MERGING));
        }
    }
}
