package leaveflow.leaveflowbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import leaveflow.leaveflowbackend.enums.PriorityLevel;

import java.time.LocalDateTime;

@Entity
@Table(name = "leave_priority_badge", uniqueConstraints = {
        @UniqueConstraint(name = "uk_priority_badge_request", columnNames = "request_id")
})
@Getter
@Setter
@NoArgsConstructor
public class PriorityBadge {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", nullable = false, length = 40)
    private String requestId;

    @Column(name = "employee_id", nullable = false)
    private String employeeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority_level", nullable = false)
    private PriorityLevel priorityLevel = PriorityLevel.NONE;

    @Column(name = "priority_reason", columnDefinition = "TEXT")
    private String priorityReason;

    @Column(name = "badge_set_at")
    private LocalDateTime badgeSetAt;

    @Column(name = "hr_notified_at")
    private LocalDateTime hrNotifiedAt;

    @Column(name = "hr_email_sent_at")
    private LocalDateTime hrEmailSentAt;
}
