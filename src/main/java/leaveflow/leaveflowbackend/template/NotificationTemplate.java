package leaveflow.leaveflowbackend.template;

import lombok.Getter;
import leaveflow.leaveflowbackend.enums.NotificationEvent;

import java.util.Map;

@Getter
public enum NotificationTemplate {
    LEAVE_SUBMITTED(NotificationEvent.LEAVE_SUBMITTED,
            "휴가 신청 접수",
            "📨 [휴가 신청 접수] #{leaveType} #{totalDays}일 (#{startDate} ~ #{endDate}) 신청이 접수되었습니다.\n" +
                    "▶ 현재 상태: #{status}"
    ),
    LEAVE_APPROVED(NotificationEvent.LEAVE_APPROVED,
            "휴가 승인",
            "🎉 [휴가 승인 완료] #{leaveType} #{totalDays}일 (#{startDate} ~ #{endDate}) 신청이 승인되었습니다.\n" +
                    "✅ 승인자: #{actor}\n" +
                    "즐거운 휴가 보내세요! 😊"
    ),
    LEAVE_REJECTED(NotificationEvent.LEAVE_REJECTED,
            "휴가 반려",
            "⚠️ [휴가 반려 안내] #{leaveType} #{totalDays}일 신청이 반려되었습니다.\n" +
                    "❌ 반려 사유: #{comment}\n" +
                    "👨‍💼 반려자: #{actor}"
    ),
    LEAVE_CANCELLED(NotificationEvent.LEAVE_CANCELLED,
            "휴가 취소",
            "🚫 [휴가 취소] #{requestId} 신청이 취소되었습니다."
    ),
    PENDING_REVIEW(NotificationEvent.PENDING_REVIEW,
            "인사팀 검토 요청",
            "🔔 [검토 요청] #{employeeId}님의 #{leaveType} #{totalDays}일 신청이 인사팀에 배정되었습니다.\n" +
                    "📝 처리 메모: #{notes}"
    ),
    PRIORITY_ELIGIBLE(NotificationEvent.PRIORITY_ELIGIBLE,
            "우선순위 설정 가능",
            "⏰ [우선순위 설정 가능] #{requestId} 신청이 #{hours}시간 동안 처리되지 않았습니다.\n" +
                    "필요하면 우선순위(노랑/빨강)를 설정해 주세요."
    ),
    PRIORITY_REQUEST(NotificationEvent.PRIORITY_REQUEST,
            "우선순위 처리 요청",
            "#{badge} [우선순위 #{priority}] #{employeeId}님이 #{requestId} 신청의 빠른 처리를 요청했습니다.\n" +
                    "📝 사유: #{reason}"
    ),
    ESCALATION_AUTO_APPROVED(NotificationEvent.ESCALATION_AUTO_APPROVED,
            "에스컬레이션 자동 승인",
            "🤖 [자동 승인] 인사팀 미응답으로 재평가한 결과 #{requestId} 신청이 자동 승인되었습니다.\n" +
                    "📊 신뢰도: #{confidence}"
    ),
    ESCALATION_TO_MANAGER(NotificationEvent.ESCALATION_TO_MANAGER,
            "긴급 결재 요청",
            "🚨 [긴급] #{employeeId}님의 #{requestId} 신청이 인사팀 미응답으로 에스컬레이션 되었습니다.\n" +
                    "🤖 재평가 결과: #{recommendation}\n" +
                    "💻 즉시 처리해 주세요."
    ),
    APPROVAL_PENDING(NotificationEvent.APPROVAL_PENDING,
            "결재 요청",
            "🔔 [휴가 승인 요청] #{employeeId}님의 #{leaveType} #{totalDays}일 신청이 #{level}단계 결재를 기다리고 있습니다.\n" +
                    "⏰ 처리 기한: #{deadline}"
    ),
    SLA_ESCALATED(NotificationEvent.SLA_ESCALATED,
            "결재 기한 초과",
            "⏰ [결재 기한 초과] #{requestId} 신청이 #{fromApprover}님의 기한 초과로 #{level}단계로 넘어왔습니다.\n" +
                    "⏰ 새 처리 기한: #{deadline}"
    ),
    SLA_EXHAUSTED(NotificationEvent.SLA_EXHAUSTED,
            "결재자 없음",
            "🚨 [결재 정체] #{requestId} 신청이 마지막 단계 기한을 넘겼고 더 이상 올릴 결재자가 없습니다. 인사팀 확인이 필요합니다."
    ),
    HR_REMINDER(NotificationEvent.HR_REMINDER,
            "우선순위 미처리 알림",
            "📋 [미처리 알림] 우선순위가 설정된 미확인 신청이 #{count}건 있습니다.\n" +
                    "#{items}"
    );

    private final NotificationEvent event;
    private final String title;
    private final String template;

    NotificationTemplate(NotificationEvent event, String title, String template) {
        this.event = event;
        this.title = title;
        this.template = template;
    }

    public static NotificationTemplate of(NotificationEvent event) {
        for (NotificationTemplate t : values()) {
            if (t.event == event) return t;
        }
        throw new IllegalArgumentException("템플릿이 없는 알림 유형입니다: " + event);
    }

    public String render(Map<String, String> variables) {
        String result = template;
        if (variables != null) {
            for (Map.Entry<String, String> entry : variables.entrySet()) {
                result = result.replace("#{" + entry.getKey() + "}", entry.getValue() != null ? entry.getValue() : "");
            }
        }
        return result;
    }
}
