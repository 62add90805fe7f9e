package leaveflow.leaveflowbackend.repository.mysql;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import leaveflow.leaveflowbackend.entity.mysql.AiModeHistory;

@Repository
public interface AiModeHistoryRepository extends JpaRepository<AiModeHistory, Long> {
    Page<AiModeHistory> findAllByOrderByChangedAtDesc(Pageable pageable);
}
