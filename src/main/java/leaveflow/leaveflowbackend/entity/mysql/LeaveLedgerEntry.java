package leaveflow.leaveflowbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import leaveflow.leaveflowbackend.enums.LedgerEntryType;
import leaveflow.leaveflowbackend.enums.LeaveType;

import java.time.LocalDateTime;

@Entity
@Table(name = "leave_ledger_entry", indexes = {
        @Index(name = "idx_ledger_request", columnList = "request_id")
})
@Getter
@Setter
@NoArgsConstructor
public class LeaveLedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", length = 40)
    private String requestId;

    @Column(name = "employee_id", nullable = false)
    private String employeeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "leave_type", nullable = false)
    private LeaveType leaveType;

    @Column(name = "days", nullable = false)
    private Double days;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false)
    private LedgerEntryType entryType;

    @Column(name = "negative_after", nullable = false)
    private boolean negativeAfter = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
