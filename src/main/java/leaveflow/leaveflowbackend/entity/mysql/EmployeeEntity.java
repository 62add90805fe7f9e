package leaveflow.leaveflowbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.*;
import leaveflow.leaveflowbackend.enums.Role;

import java.io.Serializable;

/**
 * 조직도 (읽기 전용). 결재자 결정: 매니저 → 매니저의 매니저 → HR 파트너
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "employee", indexes = {
        @Index(name = "idx_employee_manager", columnList = "manager_id"),
        @Index(name = "idx_employee_role", columnList = "role")
})
public class EmployeeEntity implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @Column(name = "employee_id", nullable = false, unique = true)
    private String employeeId;

    @Column(name = "full_name")
    private String fullName;

    @Column(name = "email")
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "role")
    private Role role = Role.EMPLOYEE;

    @Column(name = "manager_id")
    private String managerId;

    @Column(name = "hr_partner_id")
    private String hrPartnerId;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    public boolean isHrOrAdmin() {
        return role != null && role.isHrOrAdmin();
    }
}
