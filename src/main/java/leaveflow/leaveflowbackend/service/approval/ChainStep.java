package leaveflow.leaveflowbackend.service.approval;

import lombok.Value;

@Value
public class ChainStep {
    int level;
    String approver;
}
