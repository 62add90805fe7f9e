package leaveflow.leaveflowbackend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "leave.approval")
public class LeaveApprovalProperties {
    // 이 일수 이상이면 2단계(매니저의 매니저) 결재 필요
    private double level2MinDays = 5;
    // 이 일수 이상이면 3단계(HR 파트너) 결재 필요
    private double level3MinDays = 10;
}
