package leaveflow.leaveflowbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import leaveflow.leaveflowbackend.enums.LeaveType;

@Entity
@Table(name = "leave_balance", uniqueConstraints = {
        @UniqueConstraint(name = "uk_leave_balance", columnNames = {"employee_id", "leave_type", "balance_year"})
})
@Getter
@Setter
@NoArgsConstructor
public class LeaveBalance {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private String employeeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "leave_type", nullable = false)
    private LeaveType leaveType;

    @Column(name = "balance_year", nullable = false)
    private Integer year;

    @Column(name = "entitled_days", nullable = false)
    private Double entitledDays = 0.0;

    @Column(name = "used_days", nullable = false)
    private Double usedDays = 0.0;

    // 잔여가 음수가 된 적이 있음 (정정 대기)
    @Column(name = "negative_flagged", nullable = false)
    private boolean negativeFlagged = false;

    @Version
    private Long version;

    public double getRemainingDays() {
        return (entitledDays != null ? entitledDays : 0.0) - (usedDays != null ? usedDays : 0.0);
    }
}
