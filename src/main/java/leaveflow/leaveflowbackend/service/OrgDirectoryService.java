package leaveflow.leaveflowbackend.service;

import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import leaveflow.leaveflowbackend.entity.mysql.EmployeeEntity;
import leaveflow.leaveflowbackend.enums.Role;
import leaveflow.leaveflowbackend.repository.mysql.EmployeeRepository;

import java.util.List;
import java.util.Optional;

/**
 * 조직도 조회 (읽기 전용)
 */
@Service
@RequiredArgsConstructor
public class OrgDirectoryService {

    private final EmployeeRepository employeeRepository;

    /**
     * 캐시는 {@link EmployeeRepository#findByEmployeeId} 에 걸려 있음
     */
    public Optional<EmployeeEntity> findEmployee(String employeeId) {
        if (employeeId == null) {
            return Optional.empty();
        }
        return employeeRepository.findByEmployeeId(employeeId);
    }

    /**
     * 재직 중인 직원만. 없으면 IllegalArgumentException
     */
    public EmployeeEntity getActiveEmployee(String employeeId) {
        return findEmployee(employeeId)
                .filter(EmployeeEntity::isActive)
                .orElseThrow(() -> new IllegalArgumentException("재직 중인 직원을 찾을 수 없습니다: " + employeeId));
    }

    public Optional<String> managerOf(String employeeId) {
        return findEmployee(employeeId)
                .map(EmployeeEntity::getManagerId)
                .flatMap(this::activeId);
    }

    public Optional<String> hrPartnerOf(String employeeId) {
        return findEmployee(employeeId)
                .map(EmployeeEntity::getHrPartnerId)
                .flatMap(this::activeId);
    }

    public boolean isHrOrAdmin(String employeeId) {
        return findEmployee(employeeId).map(EmployeeEntity::isHrOrAdmin).orElse(false);
    }

    public Role roleOf(String employeeId) {
        return findEmployee(employeeId).map(EmployeeEntity::getRole).orElse(Role.EMPLOYEE);
    }

    @Cacheable(value = "hrStaffCache")
    @Transactional(readOnly = true)
    public List<EmployeeEntity> findActiveHrStaff() {
        return employeeRepository.findByRoleAndActiveTrue(Role.HR);
    }

    private Optional<String> activeId(String id) {
        return findEmployee(id).filter(EmployeeEntity::isActive).map(EmployeeEntity::getEmployeeId);
    }
}
