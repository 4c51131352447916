package org.operaton.trainload.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.trainload.model.FormStatus;

/**
 * DTO for today's readiness: chart value plus weekly monotony and strain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormSummaryDTO {

    private DailyLoadDTO today;
    private FormStatus formStatus;
    private Double monotony;
    private Double strain;
}
