package leaveflow.leaveflowbackend.service.oracle;

import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveType;
import leaveflow.leaveflowbackend.enums.approval.Recommendation;

/**
 * 오라클 장애 시 사용하는 규칙. 제출 경로와 에스컬레이션 경로가 같이 쓴다.
 * 오라클보다 관대한 결과를 내지 않는다.
 */
public final class FallbackRecommendation {

    public static final String OFFLINE_TAG = "oracle-offline";
    public static final double SHORT_LEAVE_MAX_DAYS = 3.0;

    private static final double APPROVE_CONFIDENCE = 0.8;
    private static final double REVIEW_CONFIDENCE = 0.5;

    private FallbackRecommendation() {
    }

    public static OracleRecommendation of(OracleRequestFacts facts) {
        boolean shortLeave = facts.getTotalDays() <= SHORT_LEAVE_MAX_DAYS;

        if (facts.isForceEscalationCheck()) {
            return shortLeave
                    ? approve("[" + OFFLINE_TAG + "] 3일 이하 단기 휴가, 에스컬레이션 폴백 자동 승인")
                    : result(Recommendation.ESCALATE, "[" + OFFLINE_TAG + "] 3일 초과, 매니저에게 에스컬레이션");
        }

        if (facts.getMode() == LeaveMode.NORMAL) {
            return shortLeave && facts.getLeaveType() == LeaveType.SICK_LEAVE
                    ? approve("[" + OFFLINE_TAG + "] 3일 이하 병가 자동 승인")
                    : result(Recommendation.REVIEW, "[" + OFFLINE_TAG + "] HR 검토 필요");
        }

        return shortLeave
                ? approve("[" + OFFLINE_TAG + "] 3일 이하 단기 휴가 자동 승인")
                : result(Recommendation.REVIEW, "[" + OFFLINE_TAG + "] 3일 초과, 검토 필요");
    }

    private static OracleRecommendation approve(String reason) {
        return OracleRecommendation.builder()
                .recommendation(Recommendation.APPROVE)
                .confidence(APPROVE_CONFIDENCE)
                .canAutoApprove(true)
                .reasonText(reason)
                .criticalViolation(false)
                .offline(true)
                .build();
    }

    private static OracleRecommendation result(Recommendation recommendation, String reason) {
        return OracleRecommendation.builder()
                .recommendation(recommendation)
                .confidence(REVIEW_CONFIDENCE)
                .canAutoApprove(false)
                .reasonText(reason)
                .criticalViolation(false)
                .offline(true)
                .build();
    }
}
