package leaveflow.leaveflowbackend.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import leaveflow.leaveflowbackend.enums.PriorityLevel;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrioritySetRequestDto {
    @NotNull(message = "우선순위는 필수입니다. (YELLOW, RED)")
    private PriorityLevel priorityLevel;

    @Size(max = 500, message = "사유는 500자 이하로 입력해 주세요.")
    private String reason;
}
