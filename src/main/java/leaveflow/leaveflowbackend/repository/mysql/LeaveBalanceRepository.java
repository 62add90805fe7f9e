package leaveflow.leaveflowbackend.repository.mysql;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import leaveflow.leaveflowbackend.entity.mysql.LeaveBalance;
import leaveflow.leaveflowbackend.enums.LeaveType;

import java.util.List;
import java.util.Optional;

@Repository
public interface LeaveBalanceRepository extends JpaRepository<LeaveBalance, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM LeaveBalance b WHERE b.employeeId = :employeeId AND b.leaveType = :leaveType AND b.year = :year")
    Optional<LeaveBalance> findForUpdate(@Param("employeeId") String employeeId,
                                         @Param("leaveType") LeaveType leaveType,
                                         @Param("year") Integer year);

    List<LeaveBalance> findByEmployeeIdAndYearOrderByLeaveTypeAsc(String employeeId, Integer year);

    boolean existsByEmployeeIdAndLeaveTypeAndYear(String employeeId, LeaveType leaveType, Integer year);
}
