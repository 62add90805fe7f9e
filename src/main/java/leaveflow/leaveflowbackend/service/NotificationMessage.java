package leaveflow.leaveflowbackend.service;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import leaveflow.leaveflowbackend.enums.NotificationEvent;
import leaveflow.leaveflowbackend.enums.Role;

import java.util.Map;

/**
 * 알림 한 건. recipientId 또는 recipientRole 중 하나만 지정
 */
@Value
@Builder
public class NotificationMessage {
    NotificationEvent event;
    String requestId;
    String recipientId;
    Role recipientRole;
    String priority;
    @Singular
    Map<String, String> variables;
    // 메일 릴레이 사용 여부 (이벤트가 메일 대상일 때만 의미 있음)
    boolean email;

    public static NotificationMessageBuilder toEmployee(String employeeId, NotificationEvent event, String requestId) {
        return NotificationMessage.builder().recipientId(employeeId).event(event).requestId(requestId)
                .email(event.isEmailEligible());
    }

    public static NotificationMessageBuilder toRole(Role role, NotificationEvent event, String requestId) {
        return NotificationMessage.builder().recipientRole(role).event(event).requestId(requestId)
                .email(event.isEmailEligible());
    }
}
