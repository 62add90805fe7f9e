package leaveflow.leaveflowbackend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModeToggleRequestDto {
    @NotBlank(message = "모드는 필수입니다. (automatic, normal)")
    private String mode;

    private String reason;
}
