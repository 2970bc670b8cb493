package com.automaker.core.state;

import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureFixtures;
import com.automaker.core.model.FeatureStatus;
import com.automaker.core.model.InvalidTransitionException;
import com.automaker.core.model.RunResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.automaker.core.model.FeatureStatus.BACKLOG;
import static com.automaker.core.model.FeatureStatus.IN_PROGRESS;
import static com.automaker.core.model.FeatureStatus.VERIFIED;
import static com.automaker.core.model.FeatureStatus.WAITING_APPROVAL;
import static org.junit.jupiter.api.Assertions.*;

class FeatureStateMachineTest {

    private static Feature feature(FeatureStatus status, boolean skipTests) {
        return FeatureFixtures.from(Feature.backlog("f1", null, "Add login", List.of()))
                .withStatus(status)
                .withSkipTests(skipTests)
                .build();
    }

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        void backlogCanOnlyStart() {
            assertTrue(FeatureStateMachine.isAllowed(BACKLOG, IN_PROGRESS));
            assertFalse(FeatureStateMachine.isAllowed(BACKLOG, VERIFIED));
            assertFalse(FeatureStateMachine.isAllowed(BACKLOG, WAITING_APPROVAL));
        }

        @Test
        void everyStatusCanBeRevertedToBacklog() {
            for (FeatureStatus from : FeatureStatus.values()) {
                assertTrue(FeatureStateMachine.isAllowed(from, BACKLOG), from + " -> backlog");
            }
        }

        @Test
        void finishedFeaturesCanBeRestarted() {
            assertTrue(FeatureStateMachine.isAllowed(WAITING_APPROVAL, IN_PROGRESS));
            assertTrue(FeatureStateMachine.isAllowed(VERIFIED, IN_PROGRESS));
            assertTrue(FeatureStateMachine.isAllowed(IN_PROGRESS, IN_PROGRESS));
        }

        @Test
        void requireTransitionThrowsWithBothStatuses() {
            InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                    () -> FeatureStateMachine.requireTransition("f1", BACKLOG, VERIFIED));
            assertTrue(ex.getMessage().contains("backlog"));
            assertTrue(ex.getMessage().contains("verified"));
        }

        @Test
        void onlyReviewableFeaturesAreMergeable() {
            assertDoesNotThrow(() -> FeatureStateMachine.requireMergeable(feature(WAITING_APPROVAL, false)));
            assertDoesNotThrow(() -> FeatureStateMachine.requireMergeable(feature(VERIFIED, false)));
            assertThrows(InvalidTransitionException.class,
                    () -> FeatureStateMachine.requireMergeable(feature(BACKLOG, false)));
            assertThrows(InvalidTransitionException.class,
                    () -> FeatureStateMachine.requireMergeable(feature(IN_PROGRESS, false)));
        }
    }

    @Nested
    @DisplayName("run outcome policy")
    class Outcome {

        @Test
        void passingRunIsVerified() {
            assertEquals(Optional.of(VERIFIED),
                    FeatureStateMachine.statusAfterRun(feature(IN_PROGRESS, false), RunResult.passed("ok")));
        }

        @Test
        void passingSkipTestsRunGoesToReview() {
            assertEquals(Optional.of(WAITING_APPROVAL),
                    FeatureStateMachine.statusAfterRun(feature(IN_PROGRESS, true), RunResult.passed("ok")));
        }

        @Test
        void failingRunGoesToReview() {
            assertEquals(Optional.of(WAITING_APPROVAL),
                    FeatureStateMachine.statusAfterRun(feature(IN_PROGRESS, false), RunResult.failed("no")));
        }

        @Test
        void stoppedRunLeavesStatusAlone() {
            assertTrue(FeatureStateMachine.statusAfterRun(feature(IN_PROGRESS, false), RunResult.cancelledByUser()).isEmpty());
        }

        @Test
        void errorAlwaysGoesToReview() {
            assertEquals(WAITING_APPROVAL, FeatureStateMachine.statusAfterError());
        }

        @Test
        void passesIsJudgedFromRereadStatus() {
            assertTrue(FeatureStateMachine.passes(feature(VERIFIED, false)));
            assertTrue(FeatureStateMachine.passes(feature(WAITING_APPROVAL, true)));
            assertFalse(FeatureStateMachine.passes(feature(WAITING_APPROVAL, false)));
            assertFalse(FeatureStateMachine.passes(feature(IN_PROGRESS, false)));
            assertFalse(FeatureStateMachine.passes(null));
        }

        @Test
        void skipTestsFeatureIsNeverAutoVerified() {
            assertEquals(WAITING_APPROVAL, FeatureStateMachine.reportedStatus(feature(IN_PROGRESS, true), VERIFIED));
            assertEquals(VERIFIED, FeatureStateMachine.reportedStatus(feature(IN_PROGRESS, false), VERIFIED));
        }

        @Test
        void verificationOutcome() {
            assertEquals(VERIFIED, FeatureStateMachine.statusAfterVerification(true));
            assertEquals(WAITING_APPROVAL, FeatureStateMachine.statusAfterVerification(false));
        }
    }
}
