package leaveflow.leaveflowbackend.service.oracle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import leaveflow.leaveflowbackend.config.LeaveOracleProperties;
import leaveflow.leaveflowbackend.dto.request.OracleAnalyzeRequestDto;
import leaveflow.leaveflowbackend.dto.request.WorkingDaysRequestDto;
import leaveflow.leaveflowbackend.dto.response.OracleAnalyzeResponseDto;
import leaveflow.leaveflowbackend.dto.response.WorkingDaysResponseDto;
import leaveflow.leaveflowbackend.enums.approval.Recommendation;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 휴가 분석 서비스(오라클) HTTP 어댑터.
 * 어떤 실패든 예외를 던지지 않고 폴백 규칙 결과를 돌려준다. 트랜잭션 밖에서만 호출할 것
 */
@Service
@Slf4j
public class DecisionOracleClient {

    private final RestTemplate restTemplate;
    private final LeaveOracleProperties properties;

    public DecisionOracleClient(RestTemplateBuilder restTemplateBuilder, LeaveOracleProperties properties) {
        this.properties = properties;
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(properties.getTimeout())
                .setReadTimeout(properties.getTimeout())
                .build();
    }

    public OracleRecommendation analyze(OracleRequestFacts facts) {
        if (!properties.isEnabled()) {
            log.debug("오라클 비활성화 상태, 폴백 규칙 사용: requestId={}", facts.getRequestId());
            return FallbackRecommendation.of(facts);
        }

        OracleAnalyzeRequestDto body = OracleAnalyzeRequestDto.builder()
                .requestId(facts.getRequestId())
                .employeeId(facts.getEmployeeId())
                .leaveType(facts.getLeaveType().getCode())
                .startDate(facts.getStartDate())
                .endDate(facts.getEndDate())
                .totalDays(facts.getTotalDays())
                .halfDay(facts.isHalfDay())
                .reason(facts.getReason())
                .forceEscalationCheck(facts.isForceEscalationCheck())
                .build();

        try {
            ResponseEntity<OracleAnalyzeResponseDto> response =
                    restTemplate.postForEntity(properties.getBaseUrl() + "/analyze", body, OracleAnalyzeResponseDto.class);

            OracleAnalyzeResponseDto dto = response.getBody();
            if (!response.getStatusCode().is2xxSuccessful() || dto == null || dto.getRecommendation() == null) {
                log.warn("오라클 응답 이상 (status={}), 폴백 사용: requestId={}", response.getStatusCode(), facts.getRequestId());
                return FallbackRecommendation.of(facts);
            }

            Recommendation recommendation = Recommendation.fromValue(dto.getRecommendation());
            return OracleRecommendation.builder()
                    .recommendation(recommendation)
                    .confidence(OracleRecommendation.clampConfidence(dto.getConfidence() != null ? dto.getConfidence() : 0.0))
                    .canAutoApprove(Boolean.TRUE.equals(dto.getCanAutoApprove()))
                    .reasonText(dto.getRecommendationReason())
                    .criticalViolation(dto.hasCriticalFailures())
                    .offline(false)
                    .build();

        } catch (RestClientException e) {
            // 타임아웃, 4xx/5xx, 연결 실패, 파싱 실패 전부 여기로
            log.warn("오라클 호출 실패, 폴백 사용: requestId={}, error={}", facts.getRequestId(), e.getMessage());
            return FallbackRecommendation.of(facts);
        }
    }

    /**
     * 근무일 계산. 실패하면 empty → 호출 측에서 달력 일수로 계산
     */
    public Optional<Double> calculateWorkingDays(LocalDate start, LocalDate end, boolean halfDay) {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }
        try {
            WorkingDaysResponseDto dto = restTemplate.postForObject(
                    properties.getBaseUrl() + "/calculate-working-days",
                    new WorkingDaysRequestDto(start, end, halfDay),
                    WorkingDaysResponseDto.class);
            if (dto == null || dto.getWorkingDays() == null || dto.getWorkingDays() < 0) {
                return Optional.empty();
            }
            return Optional.of(dto.getWorkingDays());
        } catch (RestClientException e) {
            log.warn("근무일 계산 실패, 달력 일수 사용: {} ~ {}, error={}", start, end, e.getMessage());
            return Optional.empty();
        }
    }
}
