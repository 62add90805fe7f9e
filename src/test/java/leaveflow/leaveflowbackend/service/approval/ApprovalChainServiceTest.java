package leaveflow.leaveflowbackend.service.approval;

import leaveflow.leaveflowbackend.config.LeaveApprovalProperties;
import leaveflow.leaveflowbackend.dto.response.SweepResult;
import leaveflow.leaveflowbackend.dto.response.TransitionResponseDto;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.enums.*;
import leaveflow.leaveflowbackend.enums.approval.LevelStatus;
import leaveflow.leaveflowbackend.repository.mysql.LeaveRequestRepository;
import leaveflow.leaveflowbackend.service.*;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigProvider;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigSnapshot;
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
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ApprovalChainService")
class ApprovalChainServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 6, 9, 0);

    @Mock private LeaveRequestRepository leaveRequestRepository;
    @Mock private LeaveRequestService leaveRequestService;
    @Mock private LeaveTransitionService transitionService;
    @Mock private LeaveConfigProvider configProvider;
    @Mock private OrgDirectoryService orgDirectoryService;
    @Mock private AuditService auditService;
    @Mock private NotificationService notificationService;

    private ApprovalChainService service;

    @BeforeEach
    void setUp() {
        ApprovalChainPlanner planner = new ApprovalChainPlanner(orgDirectoryService, new LeaveApprovalProperties());
        service = new ApprovalChainService(leaveRequestRepository, leaveRequestService, transitionService, planner,
                configProvider, orgDirectoryService, auditService, notificationService);
        lenient().when(configProvider.current()).thenReturn(LeaveConfigSnapshot.defaults());
        lenient().when(orgDirectoryService.managerOf("E100")).thenReturn(Optional.of("M200"));
        lenient().when(orgDirectoryService.managerOf("M200")).thenReturn(Optional.of("D300"));
        lenient().when(orgDirectoryService.hrPartnerOf("E100")).thenReturn(Optional.of("H400"));
    }

    /**
     * 6일 휴가: 1단계 M200, 2단계 D300, 3단계 없음
     */
    private static LeaveRequest twoLevelChain(LeaveRequestStatus status) {
        LeaveRequest r = new LeaveRequest();
        r.setRequestId("LR-1");
        r.setEmployeeId("E100");
        r.setLeaveType(LeaveType.VACATION);
        r.setStartDate(LocalDate.of(2026, 3, 16));
        r.setEndDate(LocalDate.of(2026, 3, 23));
        r.setTotalDays(6.0);
        r.setStatus(status);
        r.setLevel(1, "M200", LevelStatus.PENDING);
        r.setLevel(2, "D300", LevelStatus.PENDING);
        r.setLevel(3, null, LevelStatus.NOT_REQUIRED);
        r.setCurrentLevel(1);
        r.setCurrentApprover("M200");
        r.setSlaDeadline(NOW.minusHours(1));
        return r;
    }

    @Nested
    @DisplayName("approve")
    class Approve {

        @Test
        @DisplayName("level 1 approval hands the request to level 2")
        void advances() {
            LeaveRequest request = twoLevelChain(LeaveRequestStatus.PENDING);
            when(leaveRequestService.getEntity("LR-1")).thenReturn(request);
            when(transitionService.advanceChainLevel(eq("LR-1"), eq(1), eq(2), eq("D300"), eq("M200"), any(), any(), any()))
                    .thenReturn(TransitionResult.APPLIED);

            TransitionResponseDto response = service.approve("LR-1", "M200", "확인");

            assertFalse(response.isAlreadyHandled());
            verify(transitionService, never()).completeChain(any(), anyInt(), any(), any(), any());
            ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
            verify(notificationService).dispatch(captor.capture());
            assertEquals(NotificationEvent.APPROVAL_PENDING, captor.getValue().getEvent());
            assertEquals("D300", captor.getValue().getRecipientId());
        }

        @Test
        @DisplayName("last level approval completes the chain")
        void completes() {
            LeaveRequest request = twoLevelChain(LeaveRequestStatus.PENDING);
            request.setLevel(1, "M200", LevelStatus.APPROVED);
            request.setCurrentLevel(2);
            request.setCurrentApprover("D300");
            when(leaveRequestService.getEntity("LR-1")).thenReturn(request);
            when(transitionService.completeChain(eq("LR-1"), eq(2), eq("D300"), any(), any())).thenReturn(TransitionResult.APPLIED);

            service.approve("LR-1", "D300", null);

            verify(auditService).record(eq("LR-1"), eq("APPROVED"), eq(LeaveRequestStatus.PENDING),
                    eq(LeaveRequestStatus.APPROVED), eq("D300"), isNull());
            ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
            verify(notificationService).dispatch(captor.capture());
            assertEquals(NotificationEvent.LEAVE_APPROVED, captor.getValue().getEvent());
            assertEquals("E100", captor.getValue().getRecipientId());
        }

        @Test
        @DisplayName("an approver who is not current is denied")
        void wrongApprover() {
            when(leaveRequestService.getEntity("LR-1")).thenReturn(twoLevelChain(LeaveRequestStatus.PENDING));
            when(orgDirectoryService.isHrOrAdmin("D300")).thenReturn(false);

            assertThrows(AccessDeniedException.class, () -> service.approve("LR-1", "D300", null));
        }

        @Test
        @DisplayName("self approval is denied")
        void selfApproval() {
            when(leaveRequestService.getEntity("LR-1")).thenReturn(twoLevelChain(LeaveRequestStatus.PENDING));

            assertThrows(AccessDeniedException.class, () -> service.approve("LR-1", "E100", null));
        }

        @Test
        @DisplayName("request already cancelled reports already handled")
        void alreadyCancelled() {
            when(leaveRequestService.getEntity("LR-1")).thenReturn(twoLevelChain(LeaveRequestStatus.CANCELLED));

            TransitionResponseDto response = service.approve("LR-1", "M200", null);

            assertTrue(response.isAlreadyHandled());
            verifyNoInteractions(transitionService, notificationService);
        }

        @Test
        @DisplayName("PENDING_HR request is not a chain step")
        void pendingHr() {
            when(leaveRequestService.getEntity("LR-1")).thenReturn(twoLevelChain(LeaveRequestStatus.PENDING_HR));

            assertThrows(IllegalStateException.class, () -> service.approve("LR-1", "M200", null));
        }

        @Test
        @DisplayName("request without a chain cannot be chain approved")
        void noChain() {
            LeaveRequest request = twoLevelChain(LeaveRequestStatus.PENDING);
            request.setCurrentLevel(null);
            when(leaveRequestService.getEntity("LR-1")).thenReturn(request);

            assertThrows(IllegalStateException.class, () -> service.approve("LR-1", "M200", null));
        }
    }

    @Nested
    @DisplayName("SLA sweep")
    class SlaSweep {

        @Test
        @DisplayName("overdue level 1 moves to the level 2 approver")
        void level1ToLevel2() {
            LeaveRequest request = twoLevelChain(LeaveRequestStatus.PENDING);
            when(leaveRequestRepository.findSlaBreached(NOW)).thenReturn(List.of(request));
            when(transitionService.slaEscalate(eq(request), eq(2), eq("D300"), eq(NOW.plusHours(24)), eq(NOW)))
                    .thenReturn(TransitionResult.APPLIED);

            SweepResult result = service.runSlaSweep(NOW);

            assertEquals(1, result.getEscalatedCount());
            ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
            verify(notificationService).dispatch(captor.capture());
            assertEquals(NotificationEvent.SLA_ESCALATED, captor.getValue().getEvent());
            assertEquals("M200", captor.getValue().getVariables().get("fromApprover"));
        }

        @Test
        @DisplayName("overdue level 2 moves to the HR partner")
        void level2ToHrPartner() {
            LeaveRequest request = twoLevelChain(LeaveRequestStatus.PENDING);
            request.setCurrentLevel(2);
            request.setCurrentApprover("D300");
            when(leaveRequestRepository.findSlaBreached(NOW)).thenReturn(List.of(request));
            when(transitionService.slaEscalate(eq(request), eq(3), eq("H400"), any(), eq(NOW)))
                    .thenReturn(TransitionResult.APPLIED);

            assertEquals(1, service.runSlaSweep(NOW).getEscalatedCount());
        }

        @Test
        @DisplayName("overdue level 3 is exhausted and HR is told once")
        void exhausted() {
            LeaveRequest request = twoLevelChain(LeaveRequestStatus.PENDING);
            request.setCurrentLevel(3);
            request.setCurrentApprover("H400");
            when(leaveRequestRepository.findSlaBreached(NOW)).thenReturn(List.of(request));
            when(transitionService.markSlaExhausted(request, NOW)).thenReturn(true);

            SweepResult result = service.runSlaSweep(NOW);

            assertEquals(1, result.getUpdatedCount());
            ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
            verify(notificationService).dispatch(captor.capture());
            assertEquals(NotificationEvent.SLA_EXHAUSTED, captor.getValue().getEvent());
            assertEquals(Role.HR, captor.getValue().getRecipientRole());
        }

        @Test
        @DisplayName("stale snapshot is skipped without notifying")
        void staleSnapshot() {
            LeaveRequest request = twoLevelChain(LeaveRequestStatus.PENDING);
            when(leaveRequestRepository.findSlaBreached(NOW)).thenReturn(List.of(request));
            when(transitionService.slaEscalate(any(), anyInt(), any(), any(), any())).thenReturn(TransitionResult.ALREADY_HANDLED);

            SweepResult result = service.runSlaSweep(NOW);

            assertEquals(1, result.getSkippedCount());
            verifyNoInteractions(notificationService, auditService);
        }

        @Test
        @DisplayName("failure on one request does not stop the sweep")
        void errorIsolated() {
            LeaveRequest broken = twoLevelChain(LeaveRequestStatus.PENDING);
            broken.setRequestId("LR-X");
            LeaveRequest ok = twoLevelChain(LeaveRequestStatus.PENDING);
            when(leaveRequestRepository.findSlaBreached(NOW)).thenReturn(List.of(broken, ok));
            when(transitionService.slaEscalate(eq(broken), anyInt(), any(), any(), any())).thenThrow(new IllegalStateException("db"));
            when(transitionService.slaEscalate(eq(ok), anyInt(), any(), any(), any())).thenReturn(TransitionResult.APPLIED);

            SweepResult result = service.runSlaSweep(NOW);

            assertEquals(1, result.getErrorCount());
            assertEquals(1, result.getEscalatedCount());
        }
    }
}
