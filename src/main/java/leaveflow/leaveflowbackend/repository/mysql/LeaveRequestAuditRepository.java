package leaveflow.leaveflowbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequestAudit;

import java.util.List;

@Repository
public interface LeaveRequestAuditRepository extends JpaRepository<LeaveRequestAudit, Long> {
    List<LeaveRequestAudit> findByRequestIdOrderByCreatedAtAsc(String requestId);
}
