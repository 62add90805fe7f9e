package leaveflow.leaveflowbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import leaveflow.leaveflowbackend.entity.mysql.PriorityBadge;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PriorityBadgeRepository extends JpaRepository<PriorityBadge, Long> {
    Optional<PriorityBadge> findByRequestId(String requestId);

    List<PriorityBadge> findByRequestIdIn(Collection<String> requestIds);
}
