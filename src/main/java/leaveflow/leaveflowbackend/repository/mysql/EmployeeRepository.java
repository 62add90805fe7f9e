package leaveflow.leaveflowbackend.repository.mysql;

import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import leaveflow.leaveflowbackend.entity.mysql.EmployeeEntity;
import leaveflow.leaveflowbackend.enums.Role;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmployeeRepository extends JpaRepository<EmployeeEntity, String> {
    // 단건 조회는 캐시 적용
    @Cacheable(value = "employeeCache", key = "#p0", unless = "#result == null")
    Optional<EmployeeEntity> findByEmployeeId(String employeeId);

    List<EmployeeEntity> findByRoleAndActiveTrue(Role role);
}
