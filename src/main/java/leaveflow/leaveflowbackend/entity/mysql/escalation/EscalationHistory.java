package leaveflow.leaveflowbackend.entity.mysql.escalation;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import leaveflow.leaveflowbackend.enums.PriorityLevel;
import leaveflow.leaveflowbackend.enums.approval.EscalationKind;
import leaveflow.leaveflowbackend.enums.approval.EscalationTrigger;
import leaveflow.leaveflowbackend.enums.approval.ResolutionAction;

import java.time.LocalDateTime;

@Entity
@Table(name = "leave_escalation_history",
        uniqueConstraints = {
                // 미해결 상태에서만 값이 있다 → 같은 대상으로의 중복 미해결 에스컬레이션 차단
                @UniqueConstraint(name = "uk_escalation_open_guard", columnNames = "open_guard")
        },
        indexes = {
                @Index(name = "idx_escalation_request", columnList = "request_id, is_resolved")
        })
@Getter
@Setter
@NoArgsConstructor
public class EscalationHistory {

    public static final String TARGET_ORACLE = "ORACLE";
    public static final String TARGET_MANAGER = "MANAGER";
    public static final String ACTOR_SYSTEM = "SYSTEM";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", nullable = false, length = 40)
    private String requestId;

    @Enumerated(EnumType.STRING)
    @Column(name = "escalation_kind", nullable = false)
    private EscalationKind escalationKind;

    @Column(name = "escalation_level", nullable = false)
    private Integer escalationLevel;

    @Column(name = "escalated_from", nullable = false)
    private String escalatedFrom;

    @Column(name = "escalated_to", nullable = false)
    private String escalatedTo;

    @Column(name = "escalation_reason", columnDefinition = "TEXT")
    private String escalationReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "triggered_by", nullable = false)
    private EscalationTrigger triggeredBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority_level")
    private PriorityLevel priorityLevel;

    @Column(name = "is_resolved", nullable = false)
    private boolean resolved = false;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_action")
    private ResolutionAction resolutionAction;

    @Column(name = "open_guard", length = 80)
    private String openGuard;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public static String guardKey(String requestId, String target) {
        return requestId + "|" + target;
    }
}
