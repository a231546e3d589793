package net.javahippie.liftlog.model.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Request DTO for awarding XP for completed sets of one workout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AwardXpRequest {

    @NotNull(message = "userId is required")
    private UUID userId;

    @NotEmpty(message = "setIds must not be empty")
    private List<@NotNull UUID> setIds;
}
