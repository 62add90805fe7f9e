package leaveflow.leaveflowbackend.service.approval;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import leaveflow.leaveflowbackend.config.LeaveApprovalProperties;
import leaveflow.leaveflowbackend.entity.mysql.EmployeeEntity;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.enums.approval.LevelStatus;
import leaveflow.leaveflowbackend.service.OrgDirectoryService;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigSnapshot;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * 결재 단계 구성 및 SLA 초과 시 다음 결재자 결정
 *
 * 1단계: 매니저 (항상)
 * 2단계: 매니저의 매니저 (일수 ≥ level2MinDays)
 * 3단계: HR 파트너 (일수 ≥ level3MinDays)
 */
@Component
@RequiredArgsConstructor
public class ApprovalChainPlanner {

    private final OrgDirectoryService orgDirectoryService;
    private final LeaveApprovalProperties approvalProperties;

    /**
     * 자동 승인되지 않은 신청에 결재 단계를 채운다. 결재자가 하나도 없으면 단계 없이 둔다 (HR 처리)
     */
    public void initializeChain(LeaveRequest request, EmployeeEntity employee, LeaveConfigSnapshot config, LocalDateTime now) {
        double days = request.getTotalDays() != null ? request.getTotalDays() : 0.0;

        String manager = orgDirectoryService.managerOf(employee.getEmployeeId()).orElse(null);
        String managersManager = manager != null ? orgDirectoryService.managerOf(manager).orElse(null) : null;
        String hrPartner = orgDirectoryService.hrPartnerOf(employee.getEmployeeId()).orElse(null);

        request.setLevel(1, manager, manager != null ? LevelStatus.PENDING : LevelStatus.NOT_REQUIRED);
        request.setLevel(2, managersManager,
                managersManager != null && days >= approvalProperties.getLevel2MinDays() ? LevelStatus.PENDING : LevelStatus.NOT_REQUIRED);
        request.setLevel(3, hrPartner,
                hrPartner != null && days >= approvalProperties.getLevel3MinDays() ? LevelStatus.PENDING : LevelStatus.NOT_REQUIRED);

        Optional<ChainStep> first = nextPendingLevel(request, 0);
        if (first.isEmpty()) {
            request.setCurrentLevel(null);
            request.setCurrentApprover(null);
            request.setSlaDeadline(null);
            return;
        }
        request.setCurrentLevel(first.get().getLevel());
        request.setCurrentApprover(first.get().getApprover());
        request.setSlaDeadline(deadline(now, config.getApprovalSlaHours()));
    }

    /**
     * afterLevel 다음의 PENDING 단계
     */
    public Optional<ChainStep> nextPendingLevel(LeaveRequest request, int afterLevel) {
        for (int level = afterLevel + 1; level <= 3; level++) {
            if (request.getLevelStatus(level) == LevelStatus.PENDING && request.getLevelApprover(level) != null) {
                return Optional.of(new ChainStep(level, request.getLevelApprover(level)));
            }
        }
        return Optional.empty();
    }

    /**
     * SLA 초과 시 다음 결재자. 없으면 empty (더 올릴 곳 없음)
     */
    public Optional<ChainStep> nextSlaStep(LeaveRequest request) {
        String manager = orgDirectoryService.managerOf(request.getEmployeeId()).orElse(null);
        String managersManager = manager != null ? orgDirectoryService.managerOf(manager).orElse(null) : null;
        String hrPartner = request.getLevel3Approver() != null
                ? request.getLevel3Approver()
                : orgDirectoryService.hrPartnerOf(request.getEmployeeId()).orElse(null);

        return planSlaStep(request.getCurrentLevel(), request.getCurrentApprover(),
                request.getLevel2Approver() != null ? request.getLevel2Approver() : managersManager,
                hrPartner);
    }

    /**
     * 1단계 → 2단계 결재자, 없으면 HR 파트너 / 2단계 → HR 파트너 / 3단계 → 없음.
     * 현재 결재자와 같은 사람에게는 넘기지 않는다
     */
    public static Optional<ChainStep> planSlaStep(Integer currentLevel, String currentApprover,
                                                  String level2Approver, String hrPartner) {
        if (currentLevel == null) {
            return Optional.empty();
        }
        if (currentLevel == 1 && level2Approver != null && !Objects.equals(level2Approver, currentApprover)) {
            return Optional.of(new ChainStep(2, level2Approver));
        }
        if (currentLevel <= 2 && hrPartner != null && !Objects.equals(hrPartner, currentApprover)) {
            return Optional.of(new ChainStep(3, hrPartner));
        }
        return Optional.empty();
    }

    public static LocalDateTime deadline(LocalDateTime now, int hours) {
        // 조건부 UPDATE 에서 비교하므로 초 단위로 맞춘다
        return now.plusHours(hours).truncatedTo(ChronoUnit.SECONDS);
    }
}
