package leaveflow.leaveflowbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 스케줄러 1회 실행 결과
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SweepResult {
    private int candidateCount;
    private int updatedCount;   // 실제로 상태가 바뀐 건수
    private int autoApprovedCount;
    private int escalatedCount;
    private int skippedCount;   // 다른 쪽이 먼저 처리
    private int errorCount;

    public static SweepResult empty() {
        return new SweepResult();
    }

    public void incrementUpdated() { updatedCount++; }
    public void incrementAutoApproved() { autoApprovedCount++; updatedCount++; }
    public void incrementEscalated() { escalatedCount++; updatedCount++; }
    public void incrementSkipped() { skippedCount++; }
    public void incrementErrors() { errorCount++; }
}
