package com.autoagent.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A time-of-day multiplier applied to the weights of a category of tasks.
 * <p>
 * The window is inclusive at both ends and may wrap past midnight, so a rule from 22 to 4
 * covers 22:00 through 04:59.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TimeWeightRule {

    /**
     * Label used in log output, e.g. {@code "night"}.
     */
    private String name;

    /**
     * First hour (0-23) of the window.
     */
    private int startHour;

    /**
     * Last hour (0-23) of the window.
     */
    private int endHour;

    /**
     * Factor applied to the weight of each matching task.
     */
    private double multiplier;

    /**
     * Names of the tasks this rule applies to.
     */
    private List<String> tasks;

    public boolean appliesAt(int hour) {
        if (startHour <= endHour) {
            return hour >= startHour && hour <= endHour;
        }
        return hour >= startHour || hour <= endHour;
    }

    public boolean matches(String taskName) {
        return tasks != null && tasks.contains(taskName);
    }
}
