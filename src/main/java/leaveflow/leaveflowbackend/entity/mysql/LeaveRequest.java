package leaveflow.leaveflowbackend.entity.mysql;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.UpdateTimestamp;
import leaveflow.leaveflowbackend.enums.HalfDayType;
import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import leaveflow.leaveflowbackend.enums.LeaveType;
import leaveflow.leaveflowbackend.enums.approval.LevelStatus;
import leaveflow.leaveflowbackend.enums.approval.Recommendation;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Entity
@Table(name = "leave_request", indexes = {
        @Index(name = "idx_leave_request_emp", columnList = "employee_id"),
        @Index(name = "idx_leave_request_status_mode", columnList = "status, mode_at_submission"),
        @Index(name = "idx_leave_request_sla", columnList = "status, sla_deadline"),
        @Index(name = "idx_leave_request_approver", columnList = "current_approver, status")
})
@Getter
@Setter
@NoArgsConstructor
public class LeaveRequest {

    private static final DateTimeFormatter NOTE_TIME = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    @Id
    @Column(name = "request_id", length = 40)
    private String requestId;

    @Column(name = "employee_id", nullable = false)
    private String employeeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "leave_type", nullable = false)
    private LeaveType leaveType;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "total_days", nullable = false)
    private Double totalDays; // 0.5 단위

    @Enumerated(EnumType.STRING)
    @Column(name = "half_day_type")
    private HalfDayType halfDayType = HalfDayType.ALL_DAY;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private LocalDateTime submittedAt;

    // --- 처분 관련 ---
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private LeaveRequestStatus status;

    // 제출 시점 모드, 이후 변경 불가
    @Enumerated(EnumType.STRING)
    @Column(name = "mode_at_submission", nullable = false, updatable = false)
    private LeaveMode modeAtSubmission;

    @Column(name = "hr_assigned_at")
    private LocalDateTime hrAssignedAt;

    @Column(name = "hr_viewed_at")
    private LocalDateTime hrViewedAt;

    @Column(name = "can_set_priority", nullable = false)
    private boolean canSetPriority = false;

    @Column(name = "priority_eligible_at")
    private LocalDateTime priorityEligibleAt;

    @Column(name = "escalation_count", nullable = false)
    private int escalationCount = 0;

    @Column(name = "last_escalation_at")
    private LocalDateTime lastEscalationAt;

    @Column(name = "processing_notes", columnDefinition = "TEXT")
    private String processingNotes;

    @Column(name = "decided_by")
    private String decidedBy;

    @Column(name = "decided_at")
    private LocalDateTime decidedAt;

    @Column(name = "decision_comment", columnDefinition = "TEXT")
    private String decisionComment;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    // 원장 차감 여부 (중복 차감 방지용 가드)
    @Column(name = "balance_booked", nullable = false)
    private boolean balanceBooked = false;

    // 제출 시점 오라클 판단 스냅샷
    @Enumerated(EnumType.STRING)
    @Column(name = "oracle_recommendation")
    private Recommendation oracleRecommendation;

    @Column(name = "oracle_confidence")
    private Double oracleConfidence;

    @Column(name = "oracle_offline")
    private Boolean oracleOffline;

    // --- 다단계 결재 ---
    @Column(name = "current_level")
    private Integer currentLevel;

    @Column(name = "current_approver")
    private String currentApprover;

    @Column(name = "level1_approver")
    private String level1Approver;

    @Enumerated(EnumType.STRING)
    @Column(name = "level1_status")
    private LevelStatus level1Status = LevelStatus.NOT_REQUIRED;

    @Column(name = "level1_action_at")
    private LocalDateTime level1ActionAt;

    @Column(name = "level1_comments", columnDefinition = "TEXT")
    private String level1Comments;

    @Column(name = "level2_approver")
    private String level2Approver;

    @Enumerated(EnumType.STRING)
    @Column(name = "level2_status")
    private LevelStatus level2Status = LevelStatus.NOT_REQUIRED;

    @Column(name = "level2_action_at")
    private LocalDateTime level2ActionAt;

    @Column(name = "level2_comments", columnDefinition = "TEXT")
    private String level2Comments;

    @Column(name = "level3_approver")
    private String level3Approver;

    @Enumerated(EnumType.STRING)
    @Column(name = "level3_status")
    private LevelStatus level3Status = LevelStatus.NOT_REQUIRED;

    @Column(name = "level3_action_at")
    private LocalDateTime level3ActionAt;

    @Column(name = "level3_comments", columnDefinition = "TEXT")
    private String level3Comments;

    @Column(name = "sla_deadline")
    private LocalDateTime slaDeadline;

    @Column(name = "sla_breach_count", nullable = false)
    private int slaBreachCount = 0;

    // 더 이상 에스컬레이션할 결재자가 없음
    @Column(name = "sla_exhausted", nullable = false)
    private boolean slaExhausted = false;

    @Version
    private Long version;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * 처리 메모는 덧붙이기만 한다
     */
    public void appendNote(LocalDateTime at, String note) {
        String line = "[" + at.format(NOTE_TIME) + "] " + note;
        this.processingNotes = (processingNotes == null || processingNotes.isEmpty())
                ? line
                : processingNotes + "\n" + line;
    }

    public LevelStatus getLevelStatus(int level) {
        return switch (level) {
            case 1 -> level1Status;
            case 2 -> level2Status;
            case 3 -> level3Status;
            default -> throw new IllegalArgumentException("Unknown approval level: " + level);
        };
    }

    public String getLevelApprover(int level) {
        return switch (level) {
            case 1 -> level1Approver;
            case 2 -> level2Approver;
            case 3 -> level3Approver;
            default -> throw new IllegalArgumentException("Unknown approval level: " + level);
        };
    }

    public void setLevel(int level, String approver, LevelStatus status) {
        switch (level) {
            case 1 -> {
                this.level1Approver = approver;
                this.level1Status = status;
            }
            case 2 -> {
                this.level2Approver = approver;
                this.level2Status = status;
            }
            case 3 -> {
                this.level3Approver = approver;
                this.level3Status = status;
            }
            default -> throw new IllegalArgumentException("Unknown approval level: " + level);
        }
    }

    public boolean usesApprovalChain() {
        return currentLevel != null;
    }
}
