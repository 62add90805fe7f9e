package leaveflow.leaveflowbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import leaveflow.leaveflowbackend.enums.LeaveMode;

import java.time.LocalDateTime;

@Entity
@Table(name = "ai_mode_history")
@Getter
@Setter
@NoArgsConstructor
public class AiModeHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_mode", nullable = false)
    private LeaveMode previousMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_mode", nullable = false)
    private LeaveMode newMode;

    @Column(name = "changed_by", nullable = false)
    private String changedBy;

    @Column(name = "change_reason", columnDefinition = "TEXT")
    private String changeReason;

    @CreationTimestamp
    @Column(name = "changed_at", updatable = false)
    private LocalDateTime changedAt;
}
