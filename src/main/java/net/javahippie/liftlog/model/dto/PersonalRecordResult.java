package net.javahippie.liftlog.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * A new personal record: the best set of an exercise beat the user's historical best estimated 1RM.
 */
public record PersonalRecordResult(
    UUID exerciseId,
    UUID setId,
    @JsonProperty("newPR") double newPr,
    @JsonProperty("previousPR") double previousPr,
    double improvement
) {
}
