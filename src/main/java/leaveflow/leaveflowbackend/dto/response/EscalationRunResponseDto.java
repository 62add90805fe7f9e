package leaveflow.leaveflowbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class EscalationRunResponseDto {
    private SweepResult eligibility;
    private SweepResult escalations;
}
