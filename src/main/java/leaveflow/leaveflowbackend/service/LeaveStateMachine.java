package leaveflow.leaveflowbackend.service;

import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 휴가 신청 상태 전이표. 표에 없는 전이는 모두 거부
 */
public final class LeaveStateMachine {

    private static final Map<LeaveRequestStatus, Set<LeaveRequestStatus>> EDGES = new EnumMap<>(LeaveRequestStatus.class);

    static {
        EDGES.put(LeaveRequestStatus.PENDING, EnumSet.of(LeaveRequestStatus.APPROVED, LeaveRequestStatus.REJECTED, LeaveRequestStatus.CANCELLED));
        EDGES.put(LeaveRequestStatus.PENDING_HR, EnumSet.of(LeaveRequestStatus.APPROVED, LeaveRequestStatus.REJECTED, LeaveRequestStatus.CANCELLED));
        // 승인 후 본인 취소 (원장 복원)
        EDGES.put(LeaveRequestStatus.APPROVED, EnumSet.of(LeaveRequestStatus.CANCELLED));
        EDGES.put(LeaveRequestStatus.REJECTED, EnumSet.noneOf(LeaveRequestStatus.class));
        EDGES.put(LeaveRequestStatus.CANCELLED, EnumSet.noneOf(LeaveRequestStatus.class));
    }

    private LeaveStateMachine() {
    }

    public static boolean canTransition(LeaveRequestStatus from, LeaveRequestStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return EDGES.get(from).contains(to);
    }

    public static void assertTransition(LeaveRequestStatus from, LeaveRequestStatus to) {
        if (!canTransition(from, to)) {
            throw new IllegalStateException("허용되지 않는 상태 변경입니다: " + from + " → " + to);
        }
    }

    /**
     * 주어진 상태로 갈 수 있는 출발 상태들. 조건부 UPDATE 의 WHERE status IN (...) 에 사용
     */
    public static Set<LeaveRequestStatus> sourcesOf(LeaveRequestStatus to) {
        Set<LeaveRequestStatus> sources = EnumSet.noneOf(LeaveRequestStatus.class);
        EDGES.forEach((from, targets) -> {
            if (targets.contains(to)) {
                sources.add(from);
            }
        });
        return Collections.unmodifiableSet(sources);
    }

    public static Set<LeaveRequestStatus> targetsOf(LeaveRequestStatus from) {
        return Collections.unmodifiableSet(EDGES.get(from));
    }
}
