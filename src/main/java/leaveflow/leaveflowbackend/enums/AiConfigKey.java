package leaveflow.leaveflowbackend.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * ai_system_config 테이블 키와 기본값
 */
@Getter
public enum AiConfigKey {
    LEAVE_AI_MODE("leave_ai_mode", "automatic", "휴가 처리 모드 (automatic / normal)"),
    HR_RESPONSE_TIMEOUT_HOURS("hr_response_timeout_hours", "7", "HR 미응답 시 우선순위 설정 허용까지의 시간"),
    PRIORITY_ESCALATION_TIMEOUT_HOURS("priority_escalation_timeout_hours", "24", "RED 배지 이후 재평가까지의 시간"),
    NORMAL_MODE_AUTO_APPROVE_TYPES("normal_mode_auto_approve_types", "[\"SICK_LEAVE\"]", "일반 모드에서도 자동 처리하는 휴가 유형"),
    PRIORITY_EMAIL_ENABLED("priority_email_enabled", "true", "우선순위 설정 시 HR 메일 발송 여부"),
    APPROVAL_SLA_HOURS("approval_sla_hours", "48", "결재 단계별 SLA"),
    APPROVAL_SLA_ESCALATED_HOURS("approval_sla_escalated_hours", "24", "SLA 초과로 넘어간 단계의 SLA");

    private final String key;
    private final String defaultValue;
    private final String description;

    AiConfigKey(String key, String defaultValue, String description) {
        this.key = key;
        this.defaultValue = defaultValue;
        this.description = description;
    }

    public static Optional<AiConfigKey> fromKey(String key) {
        return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
    }
}
