package leaveflow.leaveflowbackend.service.mode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import leaveflow.leaveflowbackend.entity.mysql.AiModeHistory;
import leaveflow.leaveflowbackend.entity.mysql.AiSystemConfig;
import leaveflow.leaveflowbackend.enums.AiConfigKey;
import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveType;
import leaveflow.leaveflowbackend.repository.mysql.AiModeHistoryRepository;
import leaveflow.leaveflowbackend.repository.mysql.AiSystemConfigRepository;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SystemConfigService implements LeaveConfigProvider {

    private final AiSystemConfigRepository configRepository;
    private final AiModeHistoryRepository modeHistoryRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public LeaveConfigSnapshot current() {
        Map<String, String> raw = configRepository.findAll().stream()
                .collect(Collectors.toMap(AiSystemConfig::getConfigKey, AiSystemConfig::getConfigValue, (a, b) -> b));

        return LeaveConfigSnapshot.builder()
                .mode(parse(raw, AiConfigKey.LEAVE_AI_MODE, LeaveMode::fromValue))
                .hrResponseTimeoutHours(parse(raw, AiConfigKey.HR_RESPONSE_TIMEOUT_HOURS, this::parsePositiveInt))
                .priorityEscalationTimeoutHours(parse(raw, AiConfigKey.PRIORITY_ESCALATION_TIMEOUT_HOURS, this::parsePositiveInt))
                .normalModeAutoApproveTypes(parse(raw, AiConfigKey.NORMAL_MODE_AUTO_APPROVE_TYPES, this::parseLeaveTypes))
                .priorityEmailEnabled(parse(raw, AiConfigKey.PRIORITY_EMAIL_ENABLED, this::parseBoolean))
                .approvalSlaHours(parse(raw, AiConfigKey.APPROVAL_SLA_HOURS, this::parsePositiveInt))
                .approvalSlaEscalatedHours(parse(raw, AiConfigKey.APPROVAL_SLA_ESCALATED_HOURS, this::parsePositiveInt))
                .build();
    }

    /**
     * 키가 없거나 값이 깨졌으면 기본값 + 경고 로그
     */
    private <T> T parse(Map<String, String> raw, AiConfigKey key, Function<String, T> parser) {
        String value = raw.get(key.getKey());
        if (value == null) {
            log.warn("설정 키 누락, 기본값 사용: key={}, default={}", key.getKey(), key.getDefaultValue());
            return parser.apply(key.getDefaultValue());
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            log.warn("설정 값 파싱 실패, 기본값 사용: key={}, value={}, error={}", key.getKey(), value, e.getMessage());
            return parser.apply(key.getDefaultValue());
        }
    }

    private Integer parsePositiveInt(String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new IllegalArgumentException("양수여야 합니다: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("정수가 아닙니다: " + value, e);
        }
    }

    private Boolean parseBoolean(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (!"true".equals(v) && !"false".equals(v)) {
            throw new IllegalArgumentException("true/false 가 아닙니다: " + value);
        }
        return Boolean.parseBoolean(v);
    }

    private Set<LeaveType> parseLeaveTypes(String value) {
        List<String> codes;
        try {
            codes = objectMapper.readValue(value, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON 배열이 아닙니다: " + value, e);
        }
        Set<LeaveType> types = EnumSet.noneOf(LeaveType.class);
        for (String code : codes) {
            types.add(LeaveType.fromCode(code));
        }
        return Collections.unmodifiableSet(types);
    }

    // ------------------------------------------------------------------
    // 관리자 기능
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Map<String, String> getRawConfig() {
        Map<String, String> result = new LinkedHashMap<>();
        Map<String, String> stored = configRepository.findAll().stream()
                .collect(Collectors.toMap(AiSystemConfig::getConfigKey, AiSystemConfig::getConfigValue, (a, b) -> b));
        for (AiConfigKey key : AiConfigKey.values()) {
            result.put(key.getKey(), stored.getOrDefault(key.getKey(), key.getDefaultValue()));
        }
        return result;
    }

    /**
     * 모드 전환. 이력은 항상 남긴다
     */
    @Transactional
    public LeaveMode toggleMode(LeaveMode newMode, String adminId, String reason) {
        if (newMode == null) {
            throw new IllegalArgumentException("변경할 모드를 지정해야 합니다.");
        }
        LeaveMode previous = current().getMode();
        if (previous == newMode) {
            throw new IllegalStateException("이미 " + newMode.getValue() + " 모드입니다.");
        }

        writeValue(AiConfigKey.LEAVE_AI_MODE, newMode.getValue(), adminId);

        AiModeHistory history = new AiModeHistory();
        history.setPreviousMode(previous);
        history.setNewMode(newMode);
        history.setChangedBy(adminId);
        history.setChangeReason(reason);
        modeHistoryRepository.save(history);

        log.info("휴가 처리 모드 변경: {} → {} (by {})", previous, newMode, adminId);
        return newMode;
    }

    @Transactional
    public void updateConfig(String key, String value, String adminId) {
        AiConfigKey configKey = AiConfigKey.fromKey(key)
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 설정 키입니다: " + key));
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("설정 값이 비어 있습니다: " + key);
        }

        if (configKey == AiConfigKey.LEAVE_AI_MODE) {
            toggleMode(LeaveMode.fromValue(value), adminId, "설정 변경으로 모드 전환");
            return;
        }

        // 저장 전에 검증 (실패 시 IllegalArgumentException)
        switch (configKey) {
            case HR_RESPONSE_TIMEOUT_HOURS, PRIORITY_ESCALATION_TIMEOUT_HOURS,
                    APPROVAL_SLA_HOURS, APPROVAL_SLA_ESCALATED_HOURS -> parsePositiveInt(value);
            case PRIORITY_EMAIL_ENABLED -> parseBoolean(value);
            case NORMAL_MODE_AUTO_APPROVE_TYPES -> parseLeaveTypes(value);
            default -> {
            }
        }

        writeValue(configKey, value.trim(), adminId);
        log.info("시스템 설정 변경: {}={} (by {})", key, value, adminId);
    }

    @Transactional(readOnly = true)
    public Page<AiModeHistory> getModeHistory(Pageable pageable) {
        return modeHistoryRepository.findAllByOrderByChangedAtDesc(pageable);
    }

    private void writeValue(AiConfigKey key, String value, String adminId) {
        AiSystemConfig config = configRepository.findById(key.getKey())
                .orElseGet(() -> new AiSystemConfig(key.getKey(), key.getDefaultValue(), key.getDescription()));
        config.setConfigValue(value);
        config.setUpdatedBy(adminId);
        configRepository.save(config);
    }
}
