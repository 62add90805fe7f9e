package leaveflow.leaveflowbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import leaveflow.leaveflowbackend.enums.LeaveMode;

import java.util.Map;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ModeStatusResponseDto {
    private LeaveMode mode;
    private String description;
    private Map<String, String> config;
}
