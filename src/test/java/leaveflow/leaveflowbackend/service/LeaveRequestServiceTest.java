package leaveflow.leaveflowbackend.service;

import leaveflow.leaveflowbackend.config.LeaveApprovalProperties;
import leaveflow.leaveflowbackend.dto.request.LeaveSubmitRequestDto;
import leaveflow.leaveflowbackend.dto.response.LeaveRequestResponseDto;
import leaveflow.leaveflowbackend.dto.response.TransitionResponseDto;
import leaveflow.leaveflowbackend.entity.mysql.EmployeeEntity;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.enums.*;
import leaveflow.leaveflowbackend.enums.approval.LevelStatus;
import leaveflow.leaveflowbackend.enums.approval.Recommendation;
import leaveflow.leaveflowbackend.repository.mysql.LeaveRequestRepository;
import leaveflow.leaveflowbackend.repository.mysql.PriorityBadgeRepository;
import leaveflow.leaveflowbackend.repository.mysql.escalation.EscalationHistoryRepository;
import leaveflow.leaveflowbackend.service.approval.ApprovalChainPlanner;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigProvider;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigSnapshot;
import leaveflow.leaveflowbackend.service.oracle.DecisionOracleClient;
import leaveflow.leaveflowbackend.service.oracle.OracleRecommendation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeaveRequestService")
class LeaveRequestServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);

    @Mock private LeaveRequestRepository leaveRequestRepository;
    @Mock private PriorityBadgeRepository priorityBadgeRepository;
    @Mock private EscalationHistoryRepository escalationHistoryRepository;
    @Mock private LeaveTransitionService transitionService;
    @Mock private LeaveConfigProvider configProvider;
    @Mock private DecisionOracleClient oracleClient;
    @Mock private OrgDirectoryService orgDirectoryService;
    @Mock private AuditService auditService;
    @Mock private NotificationService notificationService;

    private LeaveRequestService service;

    @BeforeEach
    void setUp() {
        ApprovalChainPlanner planner = new ApprovalChainPlanner(orgDirectoryService, new LeaveApprovalProperties());
        service = new LeaveRequestService(leaveRequestRepository, priorityBadgeRepository, escalationHistoryRepository,
                transitionService, configProvider, oracleClient, orgDirectoryService, planner,
                auditService, notificationService);

        EmployeeEntity employee = new EmployeeEntity();
        employee.setEmployeeId("E100");
        lenient().when(orgDirectoryService.getActiveEmployee("E100")).thenReturn(employee);
        lenient().when(orgDirectoryService.managerOf("E100")).thenReturn(Optional.of("M200"));
        lenient().when(orgDirectoryService.managerOf("M200")).thenReturn(Optional.of("D300"));
        lenient().when(orgDirectoryService.hrPartnerOf("E100")).thenReturn(Optional.of("H400"));
        lenient().when(transitionService.persistSubmission(any(LeaveRequest.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static LeaveConfigSnapshot normalMode() {
        return LeaveConfigSnapshot.builder()
                .mode(LeaveMode.NORMAL)
                .hrResponseTimeoutHours(7)
                .priorityEscalationTimeoutHours(24)
                .normalModeAutoApproveTypes(Set.of(LeaveType.SICK_LEAVE))
                .priorityEmailEnabled(true)
                .approvalSlaHours(48)
                .approvalSlaEscalatedHours(24)
                .build();
    }

    private static OracleRecommendation approveRecommendation() {
        return OracleRecommendation.builder()
                .recommendation(Recommendation.APPROVE)
                .confidence(0.92)
                .canAutoApprove(true)
                .reasonText("규정 충족")
                .build();
    }

    private static LeaveRequest stored(String requestId, LeaveRequestStatus status) {
        LeaveRequest r = new LeaveRequest();
        r.setRequestId(requestId);
        r.setEmployeeId("E100");
        r.setLeaveType(LeaveType.VACATION);
        r.setStatus(status);
        r.setTotalDays(2.0);
        r.setCurrentApprover("M200");
        return r;
    }

    @Nested
    @DisplayName("submit")
    class Submit {

        @Test
        @DisplayName("normal mode sick leave approved by the oracle is stored as APPROVED by SYSTEM")
        void sickLeaveAutoApproved() {
            when(configProvider.current()).thenReturn(normalMode());
            when(oracleClient.calculateWorkingDays(MONDAY, MONDAY.plusDays(1), false)).thenReturn(Optional.of(2.0));
            when(oracleClient.analyze(any())).thenReturn(approveRecommendation());

            LeaveRequestResponseDto response = service.submit("E100",
                    new LeaveSubmitRequestDto("sick_leave", MONDAY, MONDAY.plusDays(1), null, "감기"));

            ArgumentCaptor<LeaveRequest> captor = ArgumentCaptor.forClass(LeaveRequest.class);
            verify(transitionService).persistSubmission(captor.capture());
            LeaveRequest saved = captor.getValue();

            assertEquals(LeaveRequestStatus.APPROVED, saved.getStatus());
            assertEquals(LeaveTransitionService.SYSTEM, saved.getDecidedBy());
            assertNull(saved.getHrAssignedAt());
            assertNull(saved.getCurrentApprover());
            assertTrue(saved.getRequestId().startsWith("LR-"));
            assertEquals(2.0, saved.getTotalDays());
            assertEquals(LeaveRequestStatus.APPROVED, response.getStatus());
            verify(auditService).record(eq(saved.getRequestId()), eq("SUBMITTED"), isNull(),
                    eq(LeaveRequestStatus.APPROVED), eq("E100"), anyString());
        }

        @Test
        @DisplayName("normal mode vacation skips the oracle and is assigned to HR with a two level chain")
        void vacationAssignedToHr() {
            when(configProvider.current()).thenReturn(normalMode());
            when(oracleClient.calculateWorkingDays(any(), any(), eq(false))).thenReturn(Optional.of(6.0));

            service.submit("E100", new LeaveSubmitRequestDto("vacation", MONDAY, MONDAY.plusDays(7), null, "여행"));

            verify(oracleClient, never()).analyze(any());
            ArgumentCaptor<LeaveRequest> captor = ArgumentCaptor.forClass(LeaveRequest.class);
            verify(transitionService).persistSubmission(captor.capture());
            LeaveRequest saved = captor.getValue();

            assertEquals(LeaveRequestStatus.PENDING, saved.getStatus());
            assertNotNull(saved.getHrAssignedAt());
            assertEquals(1, saved.getCurrentLevel());
            assertEquals("M200", saved.getCurrentApprover());
            assertEquals(LevelStatus.PENDING, saved.getLevel1Status());
            assertEquals("D300", saved.getLevel2Approver());
            assertEquals(LevelStatus.PENDING, saved.getLevel2Status());
            // 직원, HR, 결재자
            verify(notificationService, times(3)).dispatch(any(NotificationMessage.class));
        }

        @Test
        @DisplayName("critical violation goes to HR only without an approval chain")
        void criticalViolationHasNoChain() {
            when(configProvider.current()).thenReturn(normalMode());
            when(oracleClient.calculateWorkingDays(any(), any(), eq(false))).thenReturn(Optional.of(6.0));
            when(oracleClient.analyze(any())).thenReturn(OracleRecommendation.builder()
                    .recommendation(Recommendation.REJECT)
                    .confidence(0.95)
                    .canAutoApprove(false)
                    .criticalViolation(true)
                    .reasonText("진단서 누락")
                    .build());

            service.submit("E100", new LeaveSubmitRequestDto("sick_leave", MONDAY, MONDAY.plusDays(7), null, "입원"));

            ArgumentCaptor<LeaveRequest> captor = ArgumentCaptor.forClass(LeaveRequest.class);
            verify(transitionService).persistSubmission(captor.capture());
            LeaveRequest saved = captor.getValue();

            assertEquals(LeaveRequestStatus.PENDING_HR, saved.getStatus());
            assertNotNull(saved.getHrAssignedAt());
            assertNull(saved.getCurrentLevel());
            assertNull(saved.getCurrentApprover());
            assertNull(saved.getSlaDeadline());
            assertEquals(LevelStatus.NOT_REQUIRED, saved.getLevel1Status());

            // 직원, HR 만. 결재 요청 알림 없음
            ArgumentCaptor<NotificationMessage> messages = ArgumentCaptor.forClass(NotificationMessage.class);
            verify(notificationService, times(2)).dispatch(messages.capture());
            assertTrue(messages.getAllValues().stream().noneMatch(m -> m.getEvent() == NotificationEvent.APPROVAL_PENDING));
        }

        @Test
        @DisplayName("end before start is rejected before anything is stored")
        void endBeforeStart() {
            assertThrows(IllegalArgumentException.class, () -> service.submit("E100",
                    new LeaveSubmitRequestDto("vacation", MONDAY, MONDAY.minusDays(1), null, null)));
            verify(transitionService, never()).persistSubmission(any());
        }

        @Test
        @DisplayName("half day over several days is rejected")
        void halfDayRange() {
            assertThrows(IllegalArgumentException.class, () -> service.submit("E100",
                    new LeaveSubmitRequestDto("vacation", MONDAY, MONDAY.plusDays(1), HalfDayType.MORNING, null)));
        }

        @Test
        @DisplayName("unknown leave type is rejected")
        void unknownType() {
            assertThrows(IllegalArgumentException.class, () -> service.submit("E100",
                    new LeaveSubmitRequestDto("sabbatical", MONDAY, MONDAY, null, null)));
        }

        @Test
        @DisplayName("reason over the limit is rejected")
        void reasonTooLong() {
            String reason = "가".repeat(LeaveRequestService.MAX_REASON_LENGTH + 1);
            assertThrows(IllegalArgumentException.class, () -> service.submit("E100",
                    new LeaveSubmitRequestDto("vacation", MONDAY, MONDAY, null, reason)));
        }
    }

    @Nested
    @DisplayName("computeDays")
    class ComputeDays {

        @Test
        @DisplayName("half day counts 0.5 without asking the oracle")
        void halfDay() {
            assertEquals(0.5, service.computeDays(MONDAY, MONDAY, HalfDayType.AFTERNOON));
            verifyNoInteractions(oracleClient);
        }

        @Test
        @DisplayName("falls back to inclusive calendar days when the oracle is unavailable")
        void calendarFallback() {
            when(oracleClient.calculateWorkingDays(MONDAY, MONDAY.plusDays(6), false)).thenReturn(Optional.empty());

            assertEquals(7.0, service.computeDays(MONDAY, MONDAY.plusDays(6), HalfDayType.ALL_DAY));
        }

        @Test
        @DisplayName("a range without working days is rejected")
        void noWorkingDays() {
            LocalDate saturday = MONDAY.plusDays(5);
            when(oracleClient.calculateWorkingDays(saturday, saturday.plusDays(1), false)).thenReturn(Optional.of(0.0));

            assertThrows(IllegalArgumentException.class,
                    () -> service.computeDays(saturday, saturday.plusDays(1), HalfDayType.ALL_DAY));
        }
    }

    @Nested
    @DisplayName("decide")
    class Decide {

        @Test
        @DisplayName("employee cannot decide their own request")
        void selfDecision() {
            when(leaveRequestRepository.findById("LR-1")).thenReturn(Optional.of(stored("LR-1", LeaveRequestStatus.PENDING)));

            assertThrows(AccessDeniedException.class, () -> service.decide("LR-1", "E100", true, null));
            verifyNoInteractions(transitionService);
        }

        @Test
        @DisplayName("someone who is neither HR nor the current approver is denied")
        void outsider() {
            when(leaveRequestRepository.findById("LR-1")).thenReturn(Optional.of(stored("LR-1", LeaveRequestStatus.PENDING)));
            when(orgDirectoryService.isHrOrAdmin("X999")).thenReturn(false);

            assertThrows(AccessDeniedException.class, () -> service.decide("LR-1", "X999", true, null));
        }

        @Test
        @DisplayName("deciding a cancelled request is reported as already handled")
        void terminalRequest() {
            when(leaveRequestRepository.findById("LR-1")).thenReturn(Optional.of(stored("LR-1", LeaveRequestStatus.CANCELLED)));
            when(orgDirectoryService.isHrOrAdmin("H400")).thenReturn(true);

            TransitionResponseDto response = service.decide("LR-1", "H400", false, "중복");

            assertTrue(response.isAlreadyHandled());
            assertEquals(LeaveRequestStatus.CANCELLED, response.getStatus());
            verifyNoInteractions(transitionService, notificationService, auditService);
        }

        @Test
        @DisplayName("a second decision on an approved request does not conflict")
        void approvedRequestDecidedAgain() {
            when(leaveRequestRepository.findById("LR-1")).thenReturn(Optional.of(stored("LR-1", LeaveRequestStatus.APPROVED)));
            when(orgDirectoryService.isHrOrAdmin("H400")).thenReturn(true);

            TransitionResponseDto response = assertDoesNotThrow(() -> service.decide("LR-1", "H400", true, null));

            assertTrue(response.isAlreadyHandled());
            assertEquals(LeaveRequestStatus.APPROVED, response.getStatus());
            verifyNoInteractions(transitionService);
        }

        @Test
        @DisplayName("losing the race is reported as already handled without notifying")
        void lostRace() {
            LeaveRequest before = stored("LR-1", LeaveRequestStatus.PENDING);
            LeaveRequest after = stored("LR-1", LeaveRequestStatus.APPROVED);
            when(leaveRequestRepository.findById("LR-1")).thenReturn(Optional.of(before), Optional.of(after));
            when(orgDirectoryService.isHrOrAdmin("H400")).thenReturn(true);
            when(transitionService.decide(eq("LR-1"), eq(LeaveRequestStatus.REJECTED), eq("H400"), any(), any(LocalDateTime.class)))
                    .thenReturn(TransitionResult.ALREADY_HANDLED);

            TransitionResponseDto response = service.decide("LR-1", "H400", false, "인원 부족");

            assertTrue(response.isAlreadyHandled());
            assertEquals(LeaveRequestStatus.APPROVED, response.getStatus());
            verifyNoInteractions(notificationService);
            verify(auditService, never()).record(any(), any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("current approver may approve and the employee is notified")
        void approverApproves() {
            LeaveRequest before = stored("LR-1", LeaveRequestStatus.PENDING);
            LeaveRequest after = stored("LR-1", LeaveRequestStatus.APPROVED);
            when(leaveRequestRepository.findById("LR-1")).thenReturn(Optional.of(before), Optional.of(after));
            when(orgDirectoryService.isHrOrAdmin("M200")).thenReturn(false);
            when(transitionService.decide(eq("LR-1"), eq(LeaveRequestStatus.APPROVED), eq("M200"), any(), any(LocalDateTime.class)))
                    .thenReturn(TransitionResult.APPLIED);

            TransitionResponseDto response = service.decide("LR-1", "M200", true, null);

            assertFalse(response.isAlreadyHandled());
            ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
            verify(notificationService).dispatch(captor.capture());
            assertEquals(NotificationEvent.LEAVE_APPROVED, captor.getValue().getEvent());
            assertEquals("E100", captor.getValue().getRecipientId());
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("only the owner can cancel")
        void notOwner() {
            when(leaveRequestRepository.findById("LR-1")).thenReturn(Optional.of(stored("LR-1", LeaveRequestStatus.PENDING)));

            assertThrows(AccessDeniedException.class, () -> service.cancel("LR-1", "E101"));
        }

        @Test
        @DisplayName("rejected request cannot be cancelled")
        void rejectedCannotCancel() {
            when(leaveRequestRepository.findById("LR-1")).thenReturn(Optional.of(stored("LR-1", LeaveRequestStatus.REJECTED)));

            assertThrows(IllegalStateException.class, () -> service.cancel("LR-1", "E100"));
        }

        @Test
        @DisplayName("cancelling a pending request also tells the current approver")
        void pendingCancel() {
            LeaveRequest before = stored("LR-1", LeaveRequestStatus.PENDING);
            LeaveRequest after = stored("LR-1", LeaveRequestStatus.CANCELLED);
            when(leaveRequestRepository.findById("LR-1")).thenReturn(Optional.of(before), Optional.of(after));
            when(transitionService.cancel(eq("LR-1"), eq("E100"), any(LocalDateTime.class))).thenReturn(TransitionResult.APPLIED);

            TransitionResponseDto response = service.cancel("LR-1", "E100");

            assertEquals(LeaveRequestStatus.CANCELLED, response.getStatus());
            verify(notificationService, times(2)).dispatch(any(NotificationMessage.class));
        }
    }

    @Test
    @DisplayName("markViewed requires HR")
    void markViewedRequiresHr() {
        when(orgDirectoryService.isHrOrAdmin("E100")).thenReturn(false);

        assertThrows(AccessDeniedException.class, () -> service.markViewed("LR-1", "E100"));
    }
}
