package leaveflow.leaveflowbackend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfigUpdateRequestDto {
    @NotBlank(message = "설정 키는 필수입니다.")
    private String key;

    @NotBlank(message = "설정 값은 필수입니다.")
    private String value;
}
