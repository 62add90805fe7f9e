package leaveflow.leaveflowbackend.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkingDaysResponseDto {
    @JsonProperty("working_days")
    private Double workingDays;

    @JsonProperty("total_days")
    private Integer totalDays;
}
