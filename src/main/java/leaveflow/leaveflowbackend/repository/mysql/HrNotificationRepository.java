package leaveflow.leaveflowbackend.repository.mysql;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import leaveflow.leaveflowbackend.entity.mysql.HrNotification;
import leaveflow.leaveflowbackend.enums.Role;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface HrNotificationRepository extends JpaRepository<HrNotification, Long> {

    // 개인 수신 + 역할 수신을 합쳐서 조회
    @Query("SELECT n FROM HrNotification n WHERE (n.recipientId = :recipientId OR n.recipientRole IN :roles) " +
            "AND n.read = false AND n.dismissed = false ORDER BY n.createdAt DESC")
    List<HrNotification> findUnread(@Param("recipientId") String recipientId,
                                    @Param("roles") List<Role> roles,
                                    Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE HrNotification n SET n.read = true, n.readAt = :now " +
            "WHERE (n.recipientId = :recipientId OR n.recipientRole IN :roles) AND n.read = false")
    int markAllRead(@Param("recipientId") String recipientId,
                    @Param("roles") List<Role> roles,
                    @Param("now") LocalDateTime now);

    @Modifying
    @Transactional
    @Query("DELETE FROM HrNotification n WHERE n.read = true AND n.createdAt < :cutoff")
    int deleteReadBefore(@Param("cutoff") LocalDateTime cutoff);
}
