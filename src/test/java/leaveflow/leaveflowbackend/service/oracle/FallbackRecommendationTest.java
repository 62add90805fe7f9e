package leaveflow.leaveflowbackend.service.oracle;

import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveType;
import leaveflow.leaveflowbackend.enums.approval.Recommendation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FallbackRecommendation")
class FallbackRecommendationTest {

    private OracleRequestFacts facts(LeaveType type, double days, LeaveMode mode, boolean escalation) {
        return OracleRequestFacts.builder()
                .requestId("LR-1")
                .employeeId("E100")
                .leaveType(type)
                .startDate(LocalDate.of(2026, 3, 2))
                .endDate(LocalDate.of(2026, 3, 2).plusDays((long) Math.ceil(days) - 1))
                .totalDays(days)
                .mode(mode)
                .forceEscalationCheck(escalation)
                .build();
    }

    @Nested
    @DisplayName("escalation path")
    class EscalationPath {

        @Test
        @DisplayName("3 days or less approves with 0.8 confidence")
        void shortLeaveApproves() {
            OracleRecommendation r = FallbackRecommendation.of(facts(LeaveType.VACATION, 2.0, LeaveMode.NORMAL, true));

            assertEquals(Recommendation.APPROVE, r.getRecommendation());
            assertTrue(r.isCanAutoApprove());
            assertEquals(0.8, r.getConfidence());
            assertTrue(r.isOffline());
            assertTrue(r.getReasonText().contains(FallbackRecommendation.OFFLINE_TAG));
        }

        @Test
        @DisplayName("exactly 3 days is still short leave")
        void boundaryApproves() {
            OracleRecommendation r = FallbackRecommendation.of(facts(LeaveType.PERSONAL_LEAVE, 3.0, LeaveMode.AUTOMATIC, true));

            assertTrue(r.approvesAutomatically());
        }

        @Test
        @DisplayName("more than 3 days escalates without auto approval")
        void longLeaveEscalates() {
            OracleRecommendation r = FallbackRecommendation.of(facts(LeaveType.VACATION, 3.5, LeaveMode.NORMAL, true));

            assertEquals(Recommendation.ESCALATE, r.getRecommendation());
            assertFalse(r.isCanAutoApprove());
            assertEquals(0.5, r.getConfidence());
        }
    }

    @Nested
    @DisplayName("submission path")
    class SubmissionPath {

        @Test
        @DisplayName("normal mode approves only short sick leave")
        void normalModeSickOnly() {
            assertTrue(FallbackRecommendation.of(facts(LeaveType.SICK_LEAVE, 2.0, LeaveMode.NORMAL, false)).approvesAutomatically());

            OracleRecommendation vacation = FallbackRecommendation.of(facts(LeaveType.VACATION, 2.0, LeaveMode.NORMAL, false));
            assertEquals(Recommendation.REVIEW, vacation.getRecommendation());
            assertFalse(vacation.isCanAutoApprove());
        }

        @Test
        @DisplayName("automatic mode approves any short leave and reviews long leave")
        void automaticMode() {
            assertTrue(FallbackRecommendation.of(facts(LeaveType.VACATION, 1.0, LeaveMode.AUTOMATIC, false)).approvesAutomatically());

            OracleRecommendation longLeave = FallbackRecommendation.of(facts(LeaveType.SICK_LEAVE, 4.0, LeaveMode.AUTOMATIC, false));
            assertEquals(Recommendation.REVIEW, longLeave.getRecommendation());
            assertFalse(longLeave.approvesAutomatically());
        }

        @Test
        @DisplayName("fallback never reports a critical violation")
        void noCriticalViolation() {
            for (LeaveType type : LeaveType.values()) {
                assertFalse(FallbackRecommendation.of(facts(type, 10.0, LeaveMode.AUTOMATIC, false)).isCriticalViolation());
            }
        }
    }

    @Test
    @DisplayName("confidence is clamped into [0, 1]")
    void clampConfidence() {
        assertEquals(1.0, OracleRecommendation.clampConfidence(1.7));
        assertEquals(0.0, OracleRecommendation.clampConfidence(-0.2));
        assertEquals(0.0, OracleRecommendation.clampConfidence(Double.NaN));
        assertEquals(0.42, OracleRecommendation.clampConfidence(0.42));
    }
}
