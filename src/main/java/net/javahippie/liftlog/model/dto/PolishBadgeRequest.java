package net.javahippie.liftlog.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request DTO for polishing one badge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolishBadgeRequest {

    @NotNull(message = "userId is required")
    private UUID userId;

    @NotBlank(message = "achievementCode is required")
    private String achievementCode;
}
