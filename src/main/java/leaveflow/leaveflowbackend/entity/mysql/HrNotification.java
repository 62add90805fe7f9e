package leaveflow.leaveflowbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import leaveflow.leaveflowbackend.enums.NotificationEvent;
import leaveflow.leaveflowbackend.enums.Role;

import java.time.LocalDateTime;

@Entity
@Table(name = "hr_notification_queue", indexes = {
        @Index(name = "idx_notification_recipient", columnList = "recipient_id, is_read"),
        @Index(name = "idx_notification_role", columnList = "recipient_role, is_read")
})
@Getter
@Setter
@NoArgsConstructor
public class HrNotification {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_type", nullable = false)
    private NotificationEvent notificationType;

    @Column(name = "request_id", length = 40)
    private String requestId;

    // 둘 중 하나만 채워진다
    @Column(name = "recipient_id")
    private String recipientId;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_role")
    private Role recipientRole;

    @Column(name = "priority_level")
    private String priorityLevel;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "data", columnDefinition = "TEXT")
    private String payloadJson;

    @Column(name = "is_read", nullable = false)
    private boolean read = false;

    @Column(name = "is_dismissed", nullable = false)
    private boolean dismissed = false;

    @Column(name = "read_at")
    private LocalDateTime readAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
