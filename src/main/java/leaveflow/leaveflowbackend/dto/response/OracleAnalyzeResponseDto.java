package leaveflow.leaveflowbackend.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Map;

/**
 * 오라클 /analyze 응답. 모르는 필드는 무시
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OracleAnalyzeResponseDto {
    private String recommendation;

    @JsonProperty("recommendation_reason")
    private String recommendationReason;

    private Double confidence;

    @JsonProperty("can_auto_approve")
    private Boolean canAutoApprove;

    private Constraints constraints;

    @Getter
    @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Constraints {
        @JsonProperty("critical_failures")
        private List<Map<String, Object>> criticalFailures;
    }

    public boolean hasCriticalFailures() {
        return constraints != null
                && constraints.getCriticalFailures() != null
                && !constraints.getCriticalFailures().isEmpty();
    }
}
