package com.autoagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Data;

/**
 * The on-disk description of an agent, read from {@code agents/<name>.json}.
 * <p>
 * Keys are snake_case in the file ({@code loop_delay}, {@code use_time_based_weights}, ...).
 * The {@code config} array holds one block per capability provider; each block's {@code name}
 * selects the provider implementation.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentDefinition {

    /**
     * Fields that must be present in every agent file.
     */
    public static final List<String> REQUIRED_FIELDS =
            List.of("name", "bio", "traits", "examples", "loop_delay", "config", "tasks");

    static final double DEFAULT_NIGHT_MULTIPLIER = 0.4;
    static final double DEFAULT_DAY_MULTIPLIER = 1.5;

    /**
     * Tasks slowed down at night by {@code tweet_night_multiplier}.
     */
    static final List<String> POSTING_TASKS = List.of("post-echochambers");

    /**
     * Tasks sped up during the day by {@code engagement_day_multiplier}.
     */
    static final List<String> ENGAGEMENT_TASKS = List.of("reply-echochambers", "process-mentions");

    private String name;

    /**
     * Lines of the agent's biography, used as the start of the system prompt.
     */
    private List<String> bio = new ArrayList<>();

    private List<String> traits = new ArrayList<>();

    /**
     * Example messages illustrating the agent's voice.
     */
    private List<String> examples = new ArrayList<>();

    private List<String> exampleAccounts = new ArrayList<>();

    /**
     * Seconds to wait after a successful loop iteration.
     */
    private int loopDelay;

    /**
     * Provider configuration blocks, in registration order.
     */
    private List<Map<String, Object>> config = new ArrayList<>();

    private List<TaskDefinition> tasks = new ArrayList<>();

    private boolean useTimeBasedWeights;

    /**
     * Original-style multipliers ({@code tweet_night_multiplier}, {@code engagement_day_multiplier}).
     * Only consulted when {@link #timeWeightRules} is empty.
     */
    private Map<String, Double> timeBasedMultipliers = Map.of();

    /**
     * Explicit time-of-day rules. Take precedence over {@link #timeBasedMultipliers}.
     */
    private List<TimeWeightRule> timeWeightRules = new ArrayList<>();

    /**
     * Finds the configuration block for a provider.
     *
     * @param providerName The {@code name} of the block.
     * @return The block, or empty when the agent does not configure that provider.
     */
    public Optional<Map<String, Object>> providerConfig(String providerName) {
        return config.stream()
                .filter(block -> providerName.equals(block.get("name")))
                .findFirst();
    }

    /**
     * Resolves the time-of-day rules the scheduler should apply.
     * <p>
     * Explicit {@code time_weight_rules} win. Otherwise the two original rules are derived from
     * {@code time_based_multipliers}: fewer posts between 01:00 and 05:59, more replies and
     * mention handling between 08:00 and 20:59.
     *
     * @return The rules, never {@code null}.
     */
    @JsonIgnore
    public List<TimeWeightRule> getEffectiveTimeWeightRules() {
        if (timeWeightRules != null && !timeWeightRules.isEmpty()) {
            return List.copyOf(timeWeightRules);
        }
        Map<String, Double> multipliers = timeBasedMultipliers == null ? Map.of() : timeBasedMultipliers;
        return List.of(
                new TimeWeightRule("night", 1, 5,
                        multipliers.getOrDefault("tweet_night_multiplier", DEFAULT_NIGHT_MULTIPLIER),
                        POSTING_TASKS),
                new TimeWeightRule("day", 8, 20,
                        multipliers.getOrDefault("engagement_day_multiplier", DEFAULT_DAY_MULTIPLIER),
                        ENGAGEMENT_TASKS));
    }
}
