package leaveflow.leaveflowbackend.common;

public interface ResponseMessage {

    String SUCCESS = "Success.";

    String VALIDATION_FAIL = "Validation failed.";

    String NO_PERMISSION = "No Permission.";

    String ALREADY_HANDLED = "Already handled.";

    String DATABASE_ERROR = "Database Error.";
}
