package leaveflow.leaveflowbackend.service.mode;

import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import leaveflow.leaveflowbackend.enums.LeaveType;
import leaveflow.leaveflowbackend.enums.approval.Recommendation;
import leaveflow.leaveflowbackend.service.oracle.FallbackRecommendation;
import leaveflow.leaveflowbackend.service.oracle.OracleRecommendation;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * 제출 직후 처분 결정 규칙 (순수 함수)
 *
 * <pre>
 * AUTOMATIC              : 승인권고+자동승인가능 → APPROVED / 반려권고+치명위반 → PENDING_HR / 그 외 → PENDING
 * NORMAL, 허용 목록 유형 : 위와 동일, 승인이 아니면 HR 배정
 * NORMAL, 그 외 유형     : 오라클 호출 없이 PENDING + HR 배정
 * </pre>
 */
public final class ModePolicy {

    private ModePolicy() {
    }

    public static boolean requiresOracle(LeaveMode mode, Set<LeaveType> autoApproveTypes, LeaveType leaveType) {
        if (mode == LeaveMode.AUTOMATIC) {
            return true;
        }
        return autoApproveTypes != null && autoApproveTypes.contains(leaveType);
    }

    public static boolean requiresOracle(LeaveConfigSnapshot config, LeaveType leaveType) {
        return requiresOracle(config.getMode(), config.getNormalModeAutoApproveTypes(), leaveType);
    }

    /**
     * @param recommendation 오라클 결과. 오라클이 필요 없는 경우에만 null 허용
     */
    public static InitialDisposition decideInitialDisposition(LeaveType leaveType,
                                                              LeaveMode mode,
                                                              Set<LeaveType> autoApproveTypes,
                                                              OracleRecommendation recommendation,
                                                              LocalDateTime now) {
        boolean oracleRequired = requiresOracle(mode, autoApproveTypes, leaveType);

        if (!oracleRequired) {
            return new InitialDisposition(LeaveRequestStatus.PENDING,
                    "[normal] " + leaveType.getCode() + " 유형은 HR 검토 대상, 인사팀 배정", now);
        }
        if (recommendation == null) {
            throw new IllegalArgumentException("오라클 판단 결과가 필요합니다: mode=" + mode + ", type=" + leaveType);
        }

        String prefix = "[" + mode.getValue() + "]" + (recommendation.isOffline() ? "[" + FallbackRecommendation.OFFLINE_TAG + "]" : "");
        String detail = " recommendation=" + recommendation.getRecommendation().getValue()
                + ", confidence=" + recommendation.getConfidence()
                + (recommendation.getReasonText() != null ? ", reason=" + recommendation.getReasonText() : "");

        if (recommendation.approvesAutomatically()) {
            return new InitialDisposition(LeaveRequestStatus.APPROVED, prefix + " 자동 승인." + detail, null);
        }

        if (recommendation.getRecommendation() == Recommendation.REJECT && recommendation.isCriticalViolation()) {
            return new InitialDisposition(LeaveRequestStatus.PENDING_HR, prefix + " 치명적 정책 위반, 인사팀 확인 필요." + detail, now);
        }

        LocalDateTime hrAssignedAt = mode == LeaveMode.NORMAL ? now : null;
        return new InitialDisposition(LeaveRequestStatus.PENDING, prefix + " 검토 대기." + detail, hrAssignedAt);
    }
}
