package leaveflow.leaveflowbackend.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import leaveflow.leaveflowbackend.dto.response.SweepResult;
import leaveflow.leaveflowbackend.service.approval.ApprovalChainService;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "leave.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SlaEscalationScheduler {

    @Autowired
    private ApprovalChainService approvalChainService;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    /**
     * 결재 기한 초과 건을 다음 결재자에게
     */
    @Scheduled(cron = "${leave.scheduler.sla-cron:0 */15 * * * *}")
    public void scheduledSlaSweep() {
        if (isRunning.compareAndSet(false, true)) {
            try {
                log.info("=== 결재 SLA 점검 시작 ===");

                SweepResult result = approvalChainService.runSlaSweep(LocalDateTime.now());

                log.info("=== 결재 SLA 점검 완료 - 초과: {}, 에스컬레이션: {}, 건너뜀: {}, 실패: {} ===",
                        result.getCandidateCount(), result.getEscalatedCount(), result.getSkippedCount(), result.getErrorCount());
            } catch (Exception e) {
                log.error("결재 SLA 점검 중 오류 발생", e);
            } finally {
                isRunning.set(false);
            }
        } else {
            log.warn("이미 결재 SLA 점검이 실행 중입니다.");
        }
    }
}
