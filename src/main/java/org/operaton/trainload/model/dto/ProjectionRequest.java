package org.operaton.trainload.model.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO with planned daily stress, one value per day starting tomorrow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectionRequest {

    @NotEmpty(message = "Planned stress values are required")
    private List<Double> plannedStress;
}
