package leaveflow.leaveflowbackend.common;

public interface ResponseCode {

    // 성공
    String SUCCESS = "SU";

    // 유효성 검사 실패
    String VALIDATION_FAIL = "VF";

    // 권한 없음
    String NO_PERMISSION = "NP";

    // 이미 처리된 신청 (경합에서 짐)
    String ALREADY_HANDLED = "AH";

    // 데이터베이스 오류
    String DATABASE_ERROR = "DBE";
}
