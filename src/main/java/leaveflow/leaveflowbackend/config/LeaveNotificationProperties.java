package leaveflow.leaveflowbackend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "leave.notification")
public class LeaveNotificationProperties {
    // 비어 있으면 메일 릴레이 사용 안 함
    private String emailRelayUrl;
    private int retentionDays = 30;
}
