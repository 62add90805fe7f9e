package leaveflow.leaveflowbackend.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import leaveflow.leaveflowbackend.service.escalation.PriorityEscalationService;

import java.time.LocalDateTime;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "leave.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NotificationMaintenanceScheduler {

    @Autowired
    private PriorityEscalationService priorityEscalationService;

    /**
     * 매일 자정 보관 기간이 지난 읽은 알림 삭제
     */
    @Scheduled(cron = "${leave.scheduler.cleanup-cron:0 0 0 * * *}")
    public void scheduledCleanup() {
        try {
            priorityEscalationService.cleanupNotifications(LocalDateTime.now());
        } catch (Exception e) {
            log.error("알림 정리 중 오류 발생", e);
        }
    }
}
