package leaveflow.leaveflowbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;

import java.time.LocalDateTime;

@Entity
@Table(name = "leave_request_audit", indexes = {
        @Index(name = "idx_audit_request", columnList = "request_id")
})
@Getter
@Setter
@NoArgsConstructor
public class LeaveRequestAudit {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", nullable = false, length = 40)
    private String requestId;

    @Column(name = "action", nullable = false)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(name = "old_status")
    private LeaveRequestStatus oldStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status")
    private LeaveRequestStatus newStatus;

    @Column(name = "actor_id", nullable = false)
    private String actorId;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
