package leaveflow.leaveflowbackend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import leaveflow.leaveflowbackend.enums.HalfDayType;

import java.time.LocalDate;

// 휴가 신청 DTO
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaveSubmitRequestDto {
    @NotBlank(message = "휴가 종류는 필수입니다.")
    private String leaveType; // "sick_leave", "vacation" ...

    @NotNull(message = "시작일은 필수입니다.")
    private LocalDate startDate;

    @NotNull(message = "종료일은 필수입니다.")
    private LocalDate endDate;

    private HalfDayType halfDayType; // null = ALL_DAY

    @Size(max = 1000, message = "사유는 1000자 이하로 입력해 주세요.")
    private String reason;
}
