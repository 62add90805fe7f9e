package leaveflow.leaveflowbackend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "leave.oracle")
public class LeaveOracleProperties {
    private String baseUrl = "http://localhost:8001";
    private Duration timeout = Duration.ofSeconds(5);
    // false 면 호출하지 않고 바로 폴백 규칙 사용
    private boolean enabled = true;
}
