package leaveflow.leaveflowbackend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "leave.scheduler")
public class LeaveSchedulerProperties {
    private boolean enabled = true;
    private String eligibilityCron = "0 */15 * * * *";
    private String escalationCron = "0 0 * * * *";
    private String reminderCron = "0 0 9-18/2 * * MON-FRI";
    private String slaCron = "0 */15 * * * *";
    private String cleanupCron = "0 0 0 * * *";
    private int reminderBatchSize = 20;
}
