package leaveflow.leaveflowbackend.service;

import leaveflow.leaveflowbackend.entity.mysql.LeaveRequestAudit;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 감사 로그는 별도 트랜잭션에서 커밋되므로 요청 ID 를 테스트마다 다르게 사용
 */
@DataJpaTest
@ActiveProfiles("test")
@Import(AuditService.class)
@DisplayName("AuditService")
class AuditServiceTest {

    @Autowired
    private AuditService auditService;

    @Test
    @DisplayName("audit row is appended with old and new status")
    void recordsTrail() {
        auditService.record("LR-A1", "SUBMITTED", null, LeaveRequestStatus.PENDING, "E100", null);
        auditService.record("LR-A1", "APPROVED", LeaveRequestStatus.PENDING, LeaveRequestStatus.APPROVED, "H400", "확인");

        List<LeaveRequestAudit> trail = auditService.getTrail("LR-A1");

        assertEquals(2, trail.size());
        assertEquals("SUBMITTED", trail.get(0).getAction());
        assertEquals(LeaveRequestStatus.APPROVED, trail.get(1).getNewStatus());
        assertEquals("H400", trail.get(1).getActorId());
    }

    @Test
    @DisplayName("failed insert is logged and never reaches the caller")
    void insertFailureIsContained() {
        assertDoesNotThrow(() -> auditService.record("LR-A2", "CANCELLED", LeaveRequestStatus.PENDING,
                LeaveRequestStatus.CANCELLED, null, null));

        assertTrue(auditService.getTrail("LR-A2").isEmpty());
    }

    @Test
    @DisplayName("failed insert leaves later audit writes working")
    void laterWritesAfterFailure() {
        auditService.record("LR-A3", null, null, null, "E100", null);
        auditService.record("LR-A3", "VIEWED", LeaveRequestStatus.PENDING, LeaveRequestStatus.PENDING, "H400", null);

        List<LeaveRequestAudit> trail = auditService.getTrail("LR-A3");
        assertEquals(1, trail.size());
        assertEquals("VIEWED", trail.get(0).getAction());
    }
}
