package net.javahippie.liftlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.liftlog.model.entity.UserActivityWeek;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * DTO for a user's weekly training aggregate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityWeekDTO {

    private UUID userId;
    private LocalDate weekStart;
    private int activeDays;
    private int workoutsCompleted;
    private int totalSets;
    private BigDecimal totalVolumeKg;

    public static ActivityWeekDTO fromEntity(UserActivityWeek week) {
        return ActivityWeekDTO.builder()
            .userId(week.getUserId())
            .weekStart(week.getWeekStart())
            .activeDays(week.getActiveDays())
            .workoutsCompleted(week.getWorkoutsCompleted())
            .totalSets(week.getTotalSets())
            .totalVolumeKg(week.getTotalVolumeKg())
            .build();
    }
}
