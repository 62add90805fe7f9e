package leaveflow.leaveflowbackend.service.escalation;

import leaveflow.leaveflowbackend.config.LeaveNotificationProperties;
import leaveflow.leaveflowbackend.config.LeaveSchedulerProperties;
import leaveflow.leaveflowbackend.dto.response.SweepResult;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.entity.mysql.PriorityBadge;
import leaveflow.leaveflowbackend.enums.*;
import leaveflow.leaveflowbackend.repository.mysql.LeaveRequestRepository;
import leaveflow.leaveflowbackend.repository.mysql.PriorityBadgeRepository;
import leaveflow.leaveflowbackend.service.AuditService;
import leaveflow.leaveflowbackend.service.LeaveTransitionService;
import leaveflow.leaveflowbackend.service.NotificationMessage;
import leaveflow.leaveflowbackend.service.NotificationService;
import leaveflow.leaveflowbackend.service.OrgDirectoryService;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigProvider;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigSnapshot;
import leaveflow.leaveflowbackend.service.oracle.DecisionOracleClient;
import leaveflow.leaveflowbackend.service.oracle.FallbackRecommendation;
import leaveflow.leaveflowbackend.service.oracle.OracleRequestFacts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PriorityEscalationService")
class PriorityEscalationServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 5, 10, 0);

    @Mock private LeaveRequestRepository leaveRequestRepository;
    @Mock private PriorityBadgeRepository priorityBadgeRepository;
    @Mock private LeaveTransitionService transitionService;
    @Mock private LeaveConfigProvider configProvider;
    @Mock private DecisionOracleClient oracleClient;
    @Mock private OrgDirectoryService orgDirectoryService;
    @Mock private NotificationService notificationService;
    @Mock private AuditService auditService;

    private PriorityEscalationService service;

    @BeforeEach
    void setUp() {
        service = new PriorityEscalationService(leaveRequestRepository, priorityBadgeRepository, transitionService,
                configProvider, oracleClient, orgDirectoryService, notificationService, auditService,
                new LeaveSchedulerProperties(), new LeaveNotificationProperties());
        lenient().when(configProvider.current()).thenReturn(LeaveConfigSnapshot.defaults());
        // 오라클이 꺼진 상태와 같은 결과
        lenient().when(oracleClient.analyze(any(OracleRequestFacts.class)))
                .thenAnswer(invocation -> FallbackRecommendation.of(invocation.getArgument(0)));
    }

    private static LeaveRequest pending(String requestId, double days, LocalDateTime submittedAt) {
        LeaveRequest r = new LeaveRequest();
        r.setRequestId(requestId);
        r.setEmployeeId("E100");
        r.setLeaveType(LeaveType.VACATION);
        r.setStartDate(LocalDate.of(2026, 3, 16));
        r.setEndDate(LocalDate.of(2026, 3, 16).plusDays((long) days - 1));
        r.setTotalDays(days);
        r.setHalfDayType(HalfDayType.ALL_DAY);
        r.setStatus(LeaveRequestStatus.PENDING);
        r.setModeAtSubmission(LeaveMode.NORMAL);
        r.setSubmittedAt(submittedAt);
        return r;
    }

    private static PriorityBadge red(String requestId, LocalDateTime setAt) {
        PriorityBadge badge = new PriorityBadge();
        badge.setRequestId(requestId);
        badge.setEmployeeId("E100");
        badge.setPriorityLevel(PriorityLevel.RED);
        badge.setBadgeSetAt(setAt);
        return badge;
    }

    @Test
    @DisplayName("request unviewed for 8 hours becomes priority eligible and the employee is told")
    void eligibilityFlip() {
        LeaveRequest request = pending("LR-1", 2.0, NOW.minusHours(8));
        when(leaveRequestRepository.findPriorityEligibilityCandidates(eq(LeaveRequestStatus.PENDING), eq(LeaveMode.NORMAL), any()))
                .thenReturn(List.of(request));
        when(priorityBadgeRepository.findByRequestId("LR-1")).thenReturn(Optional.empty());
        when(leaveRequestRepository.flipPriorityEligible("LR-1", NOW)).thenReturn(1);

        SweepResult result = service.runEligibilitySweep(NOW);

        assertEquals(1, result.getUpdatedCount());
        ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationService).dispatch(captor.capture());
        assertEquals(NotificationEvent.PRIORITY_ELIGIBLE, captor.getValue().getEvent());
        assertEquals("E100", captor.getValue().getRecipientId());
    }

    @Test
    @DisplayName("flip lost to another run is skipped without notifying")
    void eligibilityAlreadyFlipped() {
        LeaveRequest request = pending("LR-1", 2.0, NOW.minusHours(8));
        when(leaveRequestRepository.findPriorityEligibilityCandidates(any(), any(), any())).thenReturn(List.of(request));
        when(priorityBadgeRepository.findByRequestId("LR-1")).thenReturn(Optional.empty());
        when(leaveRequestRepository.flipPriorityEligible("LR-1", NOW)).thenReturn(0);

        SweepResult result = service.runEligibilitySweep(NOW);

        assertEquals(0, result.getUpdatedCount());
        assertEquals(1, result.getSkippedCount());
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("request that was already viewed is not made eligible")
    void viewedNotEligible() {
        LeaveRequest request = pending("LR-1", 2.0, NOW.minusHours(8));
        request.setHrViewedAt(NOW.minusHours(1));
        when(leaveRequestRepository.findPriorityEligibilityCandidates(any(), any(), any())).thenReturn(List.of(request));
        when(priorityBadgeRepository.findByRequestId("LR-1")).thenReturn(Optional.empty());

        service.runEligibilitySweep(NOW);

        verify(leaveRequestRepository, never()).flipPriorityEligible(any(), any());
    }

    @Test
    @DisplayName("RED badge unviewed for 25 hours is auto approved by the offline fallback for a 2 day leave")
    void escalationAutoApprove() {
        LeaveRequest request = pending("LR-2", 2.0, NOW.minusHours(40));
        when(leaveRequestRepository.findPriorityEscalationCandidates(eq(PriorityLevel.RED), any())).thenReturn(List.of(request));
        when(priorityBadgeRepository.findByRequestId("LR-2")).thenReturn(Optional.of(red("LR-2", NOW.minusHours(25))));
        when(transitionService.autoApproveByEscalation(eq("LR-2"), any(), eq(24), eq(NOW))).thenReturn(TransitionResult.APPLIED);

        SweepResult result = service.runEscalationSweep(NOW);

        assertEquals(1, result.getAutoApprovedCount());
        verify(transitionService).claimOracleEscalation(request, 24, NOW);
        verify(transitionService, never()).escalateToManager(any(), any(), any(), anyInt(), any());
        verify(auditService).record(eq("LR-2"), eq("ESCALATION_AUTO_APPROVED"), eq(LeaveRequestStatus.PENDING),
                eq(LeaveRequestStatus.APPROVED), eq(LeaveTransitionService.SYSTEM_ESCALATION), anyString());
    }

    @Test
    @DisplayName("longer leave goes to the manager with an urgent notification")
    void escalationToManager() {
        LeaveRequest request = pending("LR-3", 5.0, NOW.minusHours(40));
        when(leaveRequestRepository.findPriorityEscalationCandidates(any(), any())).thenReturn(List.of(request));
        when(priorityBadgeRepository.findByRequestId("LR-3")).thenReturn(Optional.of(red("LR-3", NOW.minusHours(25))));
        when(orgDirectoryService.managerOf("E100")).thenReturn(Optional.of("M200"));
        when(transitionService.escalateToManager(eq("LR-3"), eq("M200"), any(), eq(24), eq(NOW))).thenReturn(true);

        SweepResult result = service.runEscalationSweep(NOW);

        assertEquals(1, result.getEscalatedCount());
        ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationService).dispatch(captor.capture());
        assertEquals(NotificationEvent.ESCALATION_TO_MANAGER, captor.getValue().getEvent());
        assertEquals("M200", captor.getValue().getRecipientId());
        assertEquals("urgent", captor.getValue().getPriority());
    }

    @Test
    @DisplayName("without a manager the escalation goes to the HR role")
    void escalationWithoutManager() {
        LeaveRequest request = pending("LR-3", 5.0, NOW.minusHours(40));
        when(leaveRequestRepository.findPriorityEscalationCandidates(any(), any())).thenReturn(List.of(request));
        when(priorityBadgeRepository.findByRequestId("LR-3")).thenReturn(Optional.of(red("LR-3", NOW.minusHours(25))));
        when(orgDirectoryService.managerOf("E100")).thenReturn(Optional.empty());
        when(transitionService.escalateToManager(eq("LR-3"), isNull(), any(), eq(24), eq(NOW))).thenReturn(true);

        service.runEscalationSweep(NOW);

        ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationService).dispatch(captor.capture());
        assertEquals(Role.HR, captor.getValue().getRecipientRole());
    }

    @Test
    @DisplayName("badge younger than the timeout is left alone")
    void badgeTooYoung() {
        LeaveRequest request = pending("LR-4", 2.0, NOW.minusHours(40));
        when(leaveRequestRepository.findPriorityEscalationCandidates(any(), any())).thenReturn(List.of(request));
        when(priorityBadgeRepository.findByRequestId("LR-4")).thenReturn(Optional.of(red("LR-4", NOW.minusHours(23))));

        SweepResult result = service.runEscalationSweep(NOW);

        assertEquals(1, result.getSkippedCount());
        verifyNoInteractions(transitionService, oracleClient);
    }

    @Test
    @DisplayName("duplicate claim from a concurrent run is skipped before calling the oracle")
    void duplicateClaim() {
        LeaveRequest request = pending("LR-5", 2.0, NOW.minusHours(40));
        when(leaveRequestRepository.findPriorityEscalationCandidates(any(), any())).thenReturn(List.of(request));
        when(priorityBadgeRepository.findByRequestId("LR-5")).thenReturn(Optional.of(red("LR-5", NOW.minusHours(30))));
        when(transitionService.claimOracleEscalation(request, 24, NOW))
                .thenThrow(new DataIntegrityViolationException("open_guard"));

        SweepResult result = service.runEscalationSweep(NOW);

        assertEquals(1, result.getSkippedCount());
        assertEquals(0, result.getErrorCount());
        verifyNoInteractions(oracleClient);
    }

    @Test
    @DisplayName("HR reminder batches all unviewed badged requests into one notification")
    void hrReminder() {
        LeaveRequest a = pending("LR-6", 2.0, NOW.minusHours(10));
        LeaveRequest b = pending("LR-7", 1.0, NOW.minusHours(9));
        when(leaveRequestRepository.findUnviewedWithBadge(any(), any(), any())).thenReturn(List.of(a, b));

        assertEquals(2, service.sendHrReminders(NOW));

        ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationService).dispatch(captor.capture());
        assertEquals(NotificationEvent.HR_REMINDER, captor.getValue().getEvent());
        assertEquals("2", captor.getValue().getVariables().get("count"));
    }

    @Test
    @DisplayName("no reminder is sent when nothing is waiting")
    void noReminder() {
        when(leaveRequestRepository.findUnviewedWithBadge(any(), any(), any())).thenReturn(Collections.emptyList());

        assertEquals(0, service.sendHrReminders(NOW));
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("cleanup purges read notifications past the retention window")
    void cleanup() {
        when(notificationService.purgeReadOlderThan(NOW.minusDays(30))).thenReturn(3);

        assertEquals(3, service.cleanupNotifications(NOW));
    }
}
