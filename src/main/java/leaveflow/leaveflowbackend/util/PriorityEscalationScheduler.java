package leaveflow.leaveflowbackend.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import leaveflow.leaveflowbackend.dto.response.SweepResult;
import leaveflow.leaveflowbackend.service.escalation.PriorityEscalationService;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "leave.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PriorityEscalationScheduler {

    @Autowired
    private PriorityEscalationService priorityEscalationService;

    private final AtomicBoolean eligibilityRunning = new AtomicBoolean(false);
    private final AtomicBoolean escalationRunning = new AtomicBoolean(false);
    private final AtomicBoolean reminderRunning = new AtomicBoolean(false);

    /**
     * 15분마다 HR 미응답 신청에 우선순위 설정 자격 부여
     */
    @Scheduled(cron = "${leave.scheduler.eligibility-cron:0 */15 * * * *}")
    public void scheduledEligibilitySweep() {
        if (eligibilityRunning.compareAndSet(false, true)) {
            try {
                log.info("=== 우선순위 자격 부여 시작 ===");

                SweepResult result = priorityEscalationService.runEligibilitySweep(LocalDateTime.now());

                log.info("=== 우선순위 자격 부여 완료 - 대상: {}, 부여: {}, 건너뜀: {}, 실패: {} ===",
                        result.getCandidateCount(), result.getUpdatedCount(), result.getSkippedCount(), result.getErrorCount());
            } catch (Exception e) {
                log.error("우선순위 자격 부여 중 오류 발생", e);
            } finally {
                eligibilityRunning.set(false);
            }
        } else {
            log.warn("이미 우선순위 자격 부여가 실행 중입니다.");
        }
    }

    /**
     * 매시 정각 RED 배지 타임아웃 재평가
     */
    @Scheduled(cron = "${leave.scheduler.escalation-cron:0 0 * * * *}")
    public void scheduledEscalationSweep() {
        if (escalationRunning.compareAndSet(false, true)) {
            try {
                log.info("=== 우선순위 에스컬레이션 시작 ===");

                SweepResult result = priorityEscalationService.runEscalationSweep(LocalDateTime.now());

                log.info("=== 우선순위 에스컬레이션 완료 - 대상: {}, 자동승인: {}, 매니저: {}, 건너뜀: {}, 실패: {} ===",
                        result.getCandidateCount(), result.getAutoApprovedCount(), result.getEscalatedCount(),
                        result.getSkippedCount(), result.getErrorCount());

                if (result.getErrorCount() > 0) {
                    log.warn("우선순위 에스컬레이션 중 {}건의 오류가 발생했습니다.", result.getErrorCount());
                }
            } catch (Exception e) {
                log.error("우선순위 에스컬레이션 중 오류 발생", e);
            } finally {
                escalationRunning.set(false);
            }
        } else {
            log.warn("이미 우선순위 에스컬레이션이 실행 중입니다.");
        }
    }

    /**
     * 평일 업무시간 2시간마다 HR 리마인더
     */
    @Scheduled(cron = "${leave.scheduler.reminder-cron:0 0 9-18/2 * * MON-FRI}")
    public void scheduledHrReminder() {
        if (reminderRunning.compareAndSet(false, true)) {
            try {
                int count = priorityEscalationService.sendHrReminders(LocalDateTime.now());
                log.info("HR 리마인더 처리 완료 - {}건", count);
            } catch (Exception e) {
                log.error("HR 리마인더 발송 중 오류 발생", e);
            } finally {
                reminderRunning.set(false);
            }
        }
    }
}
