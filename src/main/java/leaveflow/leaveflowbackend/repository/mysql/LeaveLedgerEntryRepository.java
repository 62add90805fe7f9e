package leaveflow.leaveflowbackend.repository.mysql;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import leaveflow.leaveflowbackend.entity.mysql.LeaveLedgerEntry;
import leaveflow.leaveflowbackend.enums.LedgerEntryType;

import java.util.List;

@Repository
public interface LeaveLedgerEntryRepository extends JpaRepository<LeaveLedgerEntry, Long> {
    List<LeaveLedgerEntry> findByRequestIdOrderByCreatedAtAsc(String requestId);

    long countByRequestIdAndEntryType(String requestId, LedgerEntryType entryType);
}
