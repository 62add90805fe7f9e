package leaveflow.leaveflowbackend.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// HR 승인/반려 DTO
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaveDecisionRequestDto {
    @NotNull(message = "승인 여부는 필수입니다.")
    private Boolean approve;

    private String comment;
}
