package leaveflow.leaveflowbackend.service.mode;

import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import leaveflow.leaveflowbackend.enums.LeaveType;
import leaveflow.leaveflowbackend.enums.approval.Recommendation;
import leaveflow.leaveflowbackend.service.oracle.OracleRecommendation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ModePolicy")
class ModePolicyTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);
    private static final Set<LeaveType> SICK_ONLY = Set.of(LeaveType.SICK_LEAVE);

    private OracleRecommendation recommendation(Recommendation rec, boolean canAutoApprove, boolean critical, boolean offline) {
        return OracleRecommendation.builder()
                .recommendation(rec)
                .confidence(0.9)
                .canAutoApprove(canAutoApprove)
                .criticalViolation(critical)
                .offline(offline)
                .reasonText("test")
                .build();
    }

    @Test
    @DisplayName("automatic mode always consults the oracle")
    void automaticRequiresOracle() {
        for (LeaveType type : LeaveType.values()) {
            assertTrue(ModePolicy.requiresOracle(LeaveMode.AUTOMATIC, SICK_ONLY, type));
        }
    }

    @Test
    @DisplayName("normal mode consults the oracle only for allow-listed types")
    void normalRequiresOracleForAllowList() {
        assertTrue(ModePolicy.requiresOracle(LeaveMode.NORMAL, SICK_ONLY, LeaveType.SICK_LEAVE));
        assertFalse(ModePolicy.requiresOracle(LeaveMode.NORMAL, SICK_ONLY, LeaveType.VACATION));
        assertFalse(ModePolicy.requiresOracle(LeaveMode.NORMAL, null, LeaveType.SICK_LEAVE));
    }

    @Test
    @DisplayName("normal mode, non allow-listed type goes to HR without oracle")
    void normalModeNonAllowListed() {
        InitialDisposition d = ModePolicy.decideInitialDisposition(LeaveType.VACATION, LeaveMode.NORMAL, SICK_ONLY, null, NOW);

        assertEquals(LeaveRequestStatus.PENDING, d.getStatus());
        assertEquals(NOW, d.getHrAssignedAt());
        assertTrue(d.getProcessingNotes().startsWith("[normal]"));
    }

    @Test
    @DisplayName("approve + canAutoApprove is approved without HR assignment")
    void autoApprove() {
        InitialDisposition d = ModePolicy.decideInitialDisposition(LeaveType.SICK_LEAVE, LeaveMode.NORMAL, SICK_ONLY,
                recommendation(Recommendation.APPROVE, true, false, false), NOW);

        assertTrue(d.isApproved());
        assertNull(d.getHrAssignedAt());
    }

    @Test
    @DisplayName("approve without canAutoApprove stays pending")
    void approveButNotAutomatic() {
        InitialDisposition d = ModePolicy.decideInitialDisposition(LeaveType.VACATION, LeaveMode.AUTOMATIC, SICK_ONLY,
                recommendation(Recommendation.APPROVE, false, false, false), NOW);

        assertEquals(LeaveRequestStatus.PENDING, d.getStatus());
        assertNull(d.getHrAssignedAt());
    }

    @Test
    @DisplayName("reject with critical violation goes to PENDING_HR with HR assignment")
    void criticalRejection() {
        InitialDisposition d = ModePolicy.decideInitialDisposition(LeaveType.VACATION, LeaveMode.AUTOMATIC, SICK_ONLY,
                recommendation(Recommendation.REJECT, false, true, false), NOW);

        assertEquals(LeaveRequestStatus.PENDING_HR, d.getStatus());
        assertEquals(NOW, d.getHrAssignedAt());
    }

    @Test
    @DisplayName("reject without critical violation is never auto rejected")
    void nonCriticalRejection() {
        InitialDisposition d = ModePolicy.decideInitialDisposition(LeaveType.VACATION, LeaveMode.AUTOMATIC, SICK_ONLY,
                recommendation(Recommendation.REJECT, false, false, false), NOW);

        assertEquals(LeaveRequestStatus.PENDING, d.getStatus());
    }

    @Test
    @DisplayName("normal mode allow-listed type that is not approved is assigned to HR")
    void normalModePendingAssignedToHr() {
        InitialDisposition d = ModePolicy.decideInitialDisposition(LeaveType.SICK_LEAVE, LeaveMode.NORMAL, SICK_ONLY,
                recommendation(Recommendation.REVIEW, false, false, true), NOW);

        assertEquals(LeaveRequestStatus.PENDING, d.getStatus());
        assertEquals(NOW, d.getHrAssignedAt());
        assertTrue(d.getProcessingNotes().startsWith("[normal][oracle-offline]"));
    }

    @Test
    @DisplayName("oracle result is required when the policy consults the oracle")
    void missingRecommendation() {
        assertThrows(IllegalArgumentException.class, () ->
                ModePolicy.decideInitialDisposition(LeaveType.SICK_LEAVE, LeaveMode.NORMAL, SICK_ONLY, null, NOW));
    }
}
