package leaveflow.leaveflowbackend.service.mode;

public interface LeaveConfigProvider {

    /**
     * 저장소에서 매번 새로 읽는다. 값이 없거나 깨진 키는 기본값
     */
    LeaveConfigSnapshot current();
}
