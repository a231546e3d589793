package net.javahippie.liftlog.model.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request DTO for counting a finished workout into its training week.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackWeeklyActivityRequest {

    @NotNull(message = "userId is required")
    private UUID userId;

    @NotNull(message = "workoutId is required")
    private UUID workoutId;

    /**
     * IANA zone id used when the workout has no stored zone.
     */
    @Size(max = 64, message = "timezone must not exceed 64 characters")
    private String timezone;
}
