package leaveflow.leaveflowbackend.repository.mysql.escalation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import leaveflow.leaveflowbackend.entity.mysql.escalation.EscalationHistory;
import leaveflow.leaveflowbackend.enums.approval.ResolutionAction;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface EscalationHistoryRepository extends JpaRepository<EscalationHistory, Long> {

    List<EscalationHistory> findByRequestIdOrderByCreatedAtAsc(String requestId);

    boolean existsByRequestIdAndEscalatedToAndResolvedFalse(String requestId, String escalatedTo);

    long countByRequestId(String requestId);

    // 미해결 항목 전부 해결 처리 + openGuard 해제
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE EscalationHistory e SET e.resolved = true, e.resolvedAt = :now, e.resolvedBy = :actor, " +
            "e.resolutionAction = :action, e.openGuard = NULL " +
            "WHERE e.requestId = :requestId AND e.resolved = false")
    int resolveOpen(@Param("requestId") String requestId,
                    @Param("actor") String actor,
                    @Param("action") ResolutionAction action,
                    @Param("now") LocalDateTime now);
}
