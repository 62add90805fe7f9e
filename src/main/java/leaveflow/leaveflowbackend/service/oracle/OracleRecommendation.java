package leaveflow.leaveflowbackend.service.oracle;

import lombok.Builder;
import lombok.Value;
import leaveflow.leaveflowbackend.enums.approval.Recommendation;

@Value
@Builder
public class OracleRecommendation {
    Recommendation recommendation;
    double confidence;
    boolean canAutoApprove;
    String reasonText;
    boolean criticalViolation;
    // true = 오라클 미응답으로 폴백 규칙이 만든 값
    boolean offline;

    public boolean approvesAutomatically() {
        return recommendation == Recommendation.APPROVE && canAutoApprove;
    }

    public static double clampConfidence(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
