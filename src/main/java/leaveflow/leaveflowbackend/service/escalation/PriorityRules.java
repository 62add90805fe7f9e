package leaveflow.leaveflowbackend.service.escalation;

import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 우선순위 배지 관련 판단 (순수 함수). 스케줄러는 후보를 조회하고 여기서 최종 판단한다
 */
public final class PriorityRules {

    private PriorityRules() {
    }

    /**
     * 자격 부여 스윕 대상인지
     */
    public static boolean qualifiesForEligibility(LeaveRequest request, boolean hasBadge, int hrResponseTimeoutHours, LocalDateTime now) {
        return request.getStatus() == LeaveRequestStatus.PENDING
                && request.getModeAtSubmission() == LeaveMode.NORMAL
                && request.getHrViewedAt() == null
                && !request.isCanSetPriority()
                && request.getPriorityEligibleAt() == null
                && !hasBadge
                && elapsed(request.getSubmittedAt(), hrResponseTimeoutHours, now);
    }

    /**
     * RED 배지 재평가 대상인지
     */
    public static boolean qualifiesForEscalation(LeaveRequest request, LocalDateTime badgeSetAt,
                                                 int escalationTimeoutHours, LocalDateTime now) {
        return request.getStatus() == LeaveRequestStatus.PENDING
                && request.getHrViewedAt() == null
                && badgeSetAt != null
                && elapsed(badgeSetAt, escalationTimeoutHours, now);
    }

    public static boolean elapsed(LocalDateTime since, int hours, LocalDateTime now) {
        return since != null && !since.plusHours(hours).isAfter(now);
    }

    /**
     * 설정 가능까지 남은 시간 (올림). 이미 지났으면 0
     */
    public static long hoursRemaining(LocalDateTime since, int hours, LocalDateTime now) {
        if (since == null) {
            return hours;
        }
        long minutes = Duration.between(now, since.plusHours(hours)).toMinutes();
        return minutes <= 0 ? 0 : (minutes + 59) / 60;
    }
}
