package leaveflow.leaveflowbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import leaveflow.leaveflowbackend.entity.mysql.AiSystemConfig;

@Repository
public interface AiSystemConfigRepository extends JpaRepository<AiSystemConfig, String> {
}
