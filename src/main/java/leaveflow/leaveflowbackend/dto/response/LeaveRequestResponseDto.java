package leaveflow.leaveflowbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.entity.mysql.PriorityBadge;
import leaveflow.leaveflowbackend.enums.HalfDayType;
import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import leaveflow.leaveflowbackend.enums.LeaveType;
import leaveflow.leaveflowbackend.enums.PriorityLevel;
import leaveflow.leaveflowbackend.enums.approval.LevelStatus;
import leaveflow.leaveflowbackend.enums.approval.Recommendation;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class LeaveRequestResponseDto {
    private String requestId;
    private String employeeId;
    private LeaveType leaveType;
    private LocalDate startDate;
    private LocalDate endDate;
    private Double totalDays;
    private HalfDayType halfDayType;
    private String reason;
    private LocalDateTime submittedAt;

    private LeaveRequestStatus status;
    private LeaveMode modeAtSubmission;
    private LocalDateTime hrAssignedAt;
    private LocalDateTime hrViewedAt;
    private boolean canSetPriority;
    private LocalDateTime priorityEligibleAt;
    private int escalationCount;
    private LocalDateTime lastEscalationAt;
    private String processingNotes;
    private String decidedBy;
    private LocalDateTime decidedAt;
    private String decisionComment;
    private boolean balanceBooked;

    private Recommendation oracleRecommendation;
    private Double oracleConfidence;
    private Boolean oracleOffline;

    // 우선순위
    private PriorityLevel priorityLevel;
    private LocalDateTime badgeSetAt;

    // 결재 단계
    private Integer currentLevel;
    private String currentApprover;
    private String level1Approver;
    private LevelStatus level1Status;
    private String level2Approver;
    private LevelStatus level2Status;
    private String level3Approver;
    private LevelStatus level3Status;
    private LocalDateTime slaDeadline;
    private int slaBreachCount;
    private boolean slaExhausted;

    public static LeaveRequestResponseDto fromEntity(LeaveRequest r, PriorityBadge badge) {
        LeaveRequestResponseDto dto = new LeaveRequestResponseDto();
        dto.setRequestId(r.getRequestId());
        dto.setEmployeeId(r.getEmployeeId());
        dto.setLeaveType(r.getLeaveType());
        dto.setStartDate(r.getStartDate());
        dto.setEndDate(r.getEndDate());
        dto.setTotalDays(r.getTotalDays());
        dto.setHalfDayType(r.getHalfDayType());
        dto.setReason(r.getReason());
        dto.setSubmittedAt(r.getSubmittedAt());

        dto.setStatus(r.getStatus());
        dto.setModeAtSubmission(r.getModeAtSubmission());
        dto.setHrAssignedAt(r.getHrAssignedAt());
        dto.setHrViewedAt(r.getHrViewedAt());
        dto.setCanSetPriority(r.isCanSetPriority());
        dto.setPriorityEligibleAt(r.getPriorityEligibleAt());
        dto.setEscalationCount(r.getEscalationCount());
        dto.setLastEscalationAt(r.getLastEscalationAt());
        dto.setProcessingNotes(r.getProcessingNotes());
        dto.setDecidedBy(r.getDecidedBy());
        dto.setDecidedAt(r.getDecidedAt());
        dto.setDecisionComment(r.getDecisionComment());
        dto.setBalanceBooked(r.isBalanceBooked());

        dto.setOracleRecommendation(r.getOracleRecommendation());
        dto.setOracleConfidence(r.getOracleConfidence());
        dto.setOracleOffline(r.getOracleOffline());

        dto.setPriorityLevel(badge != null ? badge.getPriorityLevel() : PriorityLevel.NONE);
        dto.setBadgeSetAt(badge != null ? badge.getBadgeSetAt() : null);

        dto.setCurrentLevel(r.getCurrentLevel());
        dto.setCurrentApprover(r.getCurrentApprover());
        dto.setLevel1Approver(r.getLevel1Approver());
        dto.setLevel1Status(r.getLevel1Status());
        dto.setLevel2Approver(r.getLevel2Approver());
        dto.setLevel2Status(r.getLevel2Status());
        dto.setLevel3Approver(r.getLevel3Approver());
        dto.setLevel3Status(r.getLevel3Status());
        dto.setSlaDeadline(r.getSlaDeadline());
        dto.setSlaBreachCount(r.getSlaBreachCount());
        dto.setSlaExhausted(r.isSlaExhausted());
        return dto;
    }
}
