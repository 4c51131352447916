package org.operaton.trainload.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.trainload.model.AcwrStatus;
import org.operaton.trainload.model.DailyLoadPoint;
import org.operaton.trainload.model.FormStatus;

import java.time.LocalDate;

/**
 * DTO for one day of the Performance Management Chart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyLoadDTO {

    private LocalDate date;
    private double dailyStress;
    private double ctl;
    private double atl;
    private double tsb;
    private Double acwr;
    private FormStatus formStatus;
    private AcwrStatus acwrStatus;

    public static DailyLoadDTO fromPoint(DailyLoadPoint point) {
        return DailyLoadDTO.builder()
                .date(point.getDate())
                .dailyStress(point.getDailyStress())
                .ctl(point.getCtl())
                .atl(point.getAtl())
                .tsb(point.getTsb())
                .acwr(point.getAcwr())
                .formStatus(point.getFormStatus())
                .acwrStatus(point.getAcwrStatus())
                .build();
    }
}
