package leaveflow.leaveflowbackend.service;

import leaveflow.leaveflowbackend.dto.response.PriorityEligibilityResponseDto;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.entity.mysql.PriorityBadge;
import leaveflow.leaveflowbackend.enums.*;
import leaveflow.leaveflowbackend.repository.mysql.LeaveRequestRepository;
import leaveflow.leaveflowbackend.repository.mysql.PriorityBadgeRepository;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigProvider;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.access.AccessDeniedException;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PriorityService")
class PriorityServiceTest {

    @Mock private LeaveRequestRepository leaveRequestRepository;
    @Mock private PriorityBadgeRepository priorityBadgeRepository;
    @Mock private LeaveConfigProvider configProvider;
    @Mock private NotificationService notificationService;
    @Mock private AuditService auditService;

    private PriorityService service;

    @BeforeEach
    void setUp() {
        service = new PriorityService(leaveRequestRepository, priorityBadgeRepository, configProvider,
                notificationService, auditService);
        lenient().when(configProvider.current()).thenReturn(LeaveConfigSnapshot.defaults());
        lenient().when(priorityBadgeRepository.saveAndFlush(any(PriorityBadge.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private void givenRequest(LeaveRequestStatus status, LocalDateTime submittedAt) {
        LeaveRequest r = new LeaveRequest();
        r.setRequestId("LR-1");
        r.setEmployeeId("E100");
        r.setLeaveType(LeaveType.VACATION);
        r.setStatus(status);
        r.setSubmittedAt(submittedAt);
        when(leaveRequestRepository.findById("LR-1")).thenReturn(Optional.of(r));
    }

    @Test
    @DisplayName("eligibility reports the hours still to wait")
    void notYetEligible() {
        givenRequest(LeaveRequestStatus.PENDING, LocalDateTime.now().minusHours(2));

        PriorityEligibilityResponseDto dto = service.checkEligibility("LR-1", "E100");

        assertFalse(dto.isEligible());
        assertTrue(dto.getHoursRemaining() >= 4 && dto.getHoursRemaining() <= 5);
        assertEquals(PriorityLevel.NONE, dto.getCurrentLevel());
    }

    @Test
    @DisplayName("eligible after the HR response timeout")
    void eligible() {
        givenRequest(LeaveRequestStatus.PENDING, LocalDateTime.now().minusHours(8));

        assertTrue(service.checkEligibility("LR-1", "E100").isEligible());
    }

    @Test
    @DisplayName("RED badge notifies the HR role urgently and consumes the flag")
    void setRed() {
        givenRequest(LeaveRequestStatus.PENDING, LocalDateTime.now().minusHours(8));
        when(priorityBadgeRepository.findByRequestId("LR-1")).thenReturn(Optional.empty());

        PriorityBadge badge = service.setPriority("LR-1", "E100", PriorityLevel.RED, "항공권 결제 마감");

        assertEquals(PriorityLevel.RED, badge.getPriorityLevel());
        assertNotNull(badge.getBadgeSetAt());
        assertNotNull(badge.getHrEmailSentAt());
        verify(leaveRequestRepository).consumePriorityFlag("LR-1");
        ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationService).dispatch(captor.capture());
        assertEquals(NotificationEvent.PRIORITY_REQUEST, captor.getValue().getEvent());
        assertEquals(Role.HR, captor.getValue().getRecipientRole());
        assertEquals("urgent", captor.getValue().getPriority());
    }

    @Test
    @DisplayName("badge can be set only once")
    void onlyOnce() {
        givenRequest(LeaveRequestStatus.PENDING, LocalDateTime.now().minusHours(8));
        PriorityBadge existing = new PriorityBadge();
        existing.setRequestId("LR-1");
        existing.setPriorityLevel(PriorityLevel.YELLOW);
        when(priorityBadgeRepository.findByRequestId("LR-1")).thenReturn(Optional.of(existing));

        assertThrows(IllegalArgumentException.class,
                () -> service.setPriority("LR-1", "E100", PriorityLevel.RED, null));
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("concurrent duplicate insert is reported as already set")
    void concurrentInsert() {
        givenRequest(LeaveRequestStatus.PENDING, LocalDateTime.now().minusHours(8));
        when(priorityBadgeRepository.findByRequestId("LR-1")).thenReturn(Optional.empty());
        when(priorityBadgeRepository.saveAndFlush(any(PriorityBadge.class)))
                .thenThrow(new DataIntegrityViolationException("uk_priority_badge_request"));

        assertThrows(IllegalArgumentException.class,
                () -> service.setPriority("LR-1", "E100", PriorityLevel.YELLOW, null));
        verify(leaveRequestRepository, never()).consumePriorityFlag(any());
    }

    @Test
    @DisplayName("setting before the timeout is rejected")
    void tooEarly() {
        givenRequest(LeaveRequestStatus.PENDING, LocalDateTime.now().minusHours(1));

        assertThrows(IllegalArgumentException.class,
                () -> service.setPriority("LR-1", "E100", PriorityLevel.YELLOW, null));
    }

    @Test
    @DisplayName("decided request cannot get a badge")
    void decided() {
        givenRequest(LeaveRequestStatus.APPROVED, LocalDateTime.now().minusHours(30));

        assertThrows(IllegalArgumentException.class,
                () -> service.setPriority("LR-1", "E100", PriorityLevel.YELLOW, null));
    }

    @Test
    @DisplayName("NONE is not a valid badge")
    void noneLevel() {
        assertThrows(IllegalArgumentException.class,
                () -> service.setPriority("LR-1", "E100", PriorityLevel.NONE, null));
    }

    @Test
    @DisplayName("other employees cannot set a badge")
    void notOwner() {
        givenRequest(LeaveRequestStatus.PENDING, LocalDateTime.now().minusHours(8));

        assertThrows(AccessDeniedException.class,
                () -> service.setPriority("LR-1", "E200", PriorityLevel.RED, null));
    }
}
