package leaveflow.leaveflowbackend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import leaveflow.leaveflowbackend.entity.mysql.LeaveBalance;
import leaveflow.leaveflowbackend.entity.mysql.LeaveLedgerEntry;
import leaveflow.leaveflowbackend.enums.LedgerEntryType;
import leaveflow.leaveflowbackend.enums.LeaveType;
import leaveflow.leaveflowbackend.repository.mysql.LeaveBalanceRepository;
import leaveflow.leaveflowbackend.repository.mysql.LeaveLedgerEntryRepository;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 휴가 잔여 원장. 차감/복원만 담당하고 중복 차감 방지는 호출 측 balanceBooked 가드가 맡는다
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveBalanceService {

    private final LeaveBalanceRepository balanceRepository;
    private final LeaveLedgerEntryRepository ledgerRepository;

    @Transactional
    public void book(String employeeId, LeaveType leaveType, double days, String requestId, int year) {
        apply(employeeId, leaveType, days, requestId, year, LedgerEntryType.BOOK);
    }

    @Transactional
    public void reverse(String employeeId, LeaveType leaveType, double days, String requestId, int year) {
        apply(employeeId, leaveType, days, requestId, year, LedgerEntryType.REVERSE);
    }

    private void apply(String employeeId, LeaveType leaveType, double days, String requestId, int year, LedgerEntryType type) {
        if (days == 0) {
            return;
        }
        if (days < 0) {
            throw new IllegalArgumentException("차감 일수는 음수일 수 없습니다: " + days);
        }

        LeaveBalance balance = balanceRepository.findForUpdate(employeeId, leaveType, year)
                .orElseGet(() -> balanceRepository.save(newBalance(employeeId, leaveType, year)));

        double used = balance.getUsedDays() != null ? balance.getUsedDays() : 0.0;
        balance.setUsedDays(type == LedgerEntryType.BOOK ? used + days : Math.max(0.0, used - days));

        boolean negative = balance.getRemainingDays() < 0;
        if (negative) {
            // 차감은 그대로 반영하고 표시만 해둔다
            balance.setNegativeFlagged(true);
            log.warn("휴가 잔여 음수 발생: employeeId={}, type={}, year={}, remaining={}, requestId={}",
                    employeeId, leaveType, year, balance.getRemainingDays(), requestId);
        }
        balanceRepository.save(balance);

        LeaveLedgerEntry entry = new LeaveLedgerEntry();
        entry.setRequestId(requestId);
        entry.setEmployeeId(employeeId);
        entry.setLeaveType(leaveType);
        entry.setDays(days);
        entry.setEntryType(type);
        entry.setNegativeAfter(negative);
        ledgerRepository.save(entry);

        log.info("휴가 원장 {}: employeeId={}, type={}, days={}, requestId={}", type, employeeId, leaveType, days, requestId);
    }

    /**
     * 연도별 잔여 조회. 행이 없는 유형은 기본 부여일수로 채워서 보여준다 (저장하지 않음)
     */
    @Transactional(readOnly = true)
    public List<LeaveBalance> getBalances(String employeeId, int year) {
        Map<LeaveType, LeaveBalance> byType = new EnumMap<>(LeaveType.class);
        for (LeaveBalance b : balanceRepository.findByEmployeeIdAndYearOrderByLeaveTypeAsc(employeeId, year)) {
            byType.put(b.getLeaveType(), b);
        }
        List<LeaveBalance> result = new ArrayList<>();
        for (LeaveType type : LeaveType.values()) {
            result.add(byType.getOrDefault(type, newBalance(employeeId, type, year)));
        }
        return result;
    }

    /**
     * 없는 유형만 기본 부여일수로 생성. 생성된 건수 반환
     */
    @Transactional
    public int initializeBalances(String employeeId, int year) {
        int created = 0;
        for (LeaveType type : LeaveType.values()) {
            if (!balanceRepository.existsByEmployeeIdAndLeaveTypeAndYear(employeeId, type, year)) {
                balanceRepository.save(newBalance(employeeId, type, year));
                created++;
            }
        }
        log.info("휴가 잔여 초기화: employeeId={}, year={}, created={}", employeeId, year, created);
        return created;
    }

    private LeaveBalance newBalance(String employeeId, LeaveType type, int year) {
        LeaveBalance balance = new LeaveBalance();
        balance.setEmployeeId(employeeId);
        balance.setLeaveType(type);
        balance.setYear(year);
        balance.setEntitledDays(type.getDefaultEntitlement());
        balance.setUsedDays(0.0);
        return balance;
    }
}
