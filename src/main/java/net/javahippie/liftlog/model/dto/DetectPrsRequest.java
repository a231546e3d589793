package net.javahippie.liftlog.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request DTO for personal record detection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectPrsRequest {

    @NotNull(message = "workoutId is required")
    private UUID workoutId;
}
