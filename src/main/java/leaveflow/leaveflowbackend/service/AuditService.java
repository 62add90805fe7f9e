package leaveflow.leaveflowbackend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequestAudit;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import leaveflow.leaveflowbackend.repository.mysql.LeaveRequestAuditRepository;

import java.util.List;

/**
 * 감사 로그. 실패해도 본 처리에는 영향 없음
 */
@Service
@Slf4j
public class AuditService {

    private final LeaveRequestAuditRepository auditRepository;
    private final TransactionTemplate requiresNew;

    public AuditService(LeaveRequestAuditRepository auditRepository, PlatformTransactionManager transactionManager) {
        this.auditRepository = auditRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * 별도 트랜잭션에서 저장. 롤백까지 끝난 뒤에 예외를 잡는다
     */
    public void record(String requestId, String action, LeaveRequestStatus oldStatus,
                       LeaveRequestStatus newStatus, String actorId, String reason) {
        try {
            requiresNew.executeWithoutResult(status -> {
                LeaveRequestAudit audit = new LeaveRequestAudit();
                audit.setRequestId(requestId);
                audit.setAction(action);
                audit.setOldStatus(oldStatus);
                audit.setNewStatus(newStatus);
                audit.setActorId(actorId);
                audit.setReason(reason);
                auditRepository.saveAndFlush(audit);
            });
        } catch (Exception e) {
            log.error("감사 로그 저장 실패: requestId={}, action={}", requestId, action, e);
        }
    }

    @Transactional(readOnly = true)
    public List<LeaveRequestAudit> getTrail(String requestId) {
        return auditRepository.findByRequestIdOrderByCreatedAtAsc(requestId);
    }
}
