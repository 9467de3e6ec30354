package com.autoagent.scheduler;

import com.autoagent.exception.ConfigurationException;
import com.autoagent.model.TaskDefinition;
import com.autoagent.model.TimeWeightRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the next task by weighted random draw.
 * <p>
 * The base weights are fixed at construction. When time adjustment is requested, every rule
 * whose window contains the given hour multiplies the weights of the tasks it names. Selection
 * never modifies the scheduler: the adjusted weights are recomputed on each draw.
 */
@Slf4j
public class TaskScheduler {

    private final List<TaskDefinition> tasks;
    private final List<TimeWeightRule> rules;
    private final Random random;

    /**
     * @throws ConfigurationException if there are no tasks, a weight is negative, or a rule has a
     *                                negative multiplier or an hour outside 0-23.
     */
    public TaskScheduler(List<TaskDefinition> tasks, List<TimeWeightRule> rules, Random random) {
        if (tasks == null || tasks.isEmpty()) {
            throw new ConfigurationException("An agent needs at least one task");
        }
        for (TaskDefinition task : tasks) {
            if (task.weight() < 0 || Double.isNaN(task.weight())) {
                throw new ConfigurationException("Task '" + task.name() + "' has a negative weight: " + task.weight());
            }
        }
        if (rules != null) {
            rules.forEach(TaskScheduler::checkRule);
        }
        this.tasks = List.copyOf(tasks);
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.random = random;
    }

    private static void checkRule(TimeWeightRule rule) {
        if (rule == null) {
            throw new ConfigurationException("Time weight rules must not be null");
        }
        if (rule.getMultiplier() < 0 || Double.isNaN(rule.getMultiplier()) || Double.isInfinite(rule.getMultiplier())) {
            throw new ConfigurationException("Time weight rule '" + rule.getName() + "' has an invalid multiplier: " + rule.getMultiplier());
        }
        if (!isHour(rule.getStartHour()) || !isHour(rule.getEndHour())) {
            throw new ConfigurationException("Time weight rule '" + rule.getName() + "' must use hours 0-23, got "
                    + rule.getStartHour() + "-" + rule.getEndHour());
        }
        if (rule.getTasks() == null || rule.getTasks().isEmpty()) {
            throw new ConfigurationException("Time weight rule '" + rule.getName() + "' names no tasks");
        }
    }

    private static boolean isHour(int hour) {
        return hour >= 0 && hour <= 23;
    }

    public List<TaskDefinition> getTasks() {
        return tasks;
    }

    /**
     * Computes the weight of every task for one draw, in task order.
     *
     * @param hour         Hour of day, 0-23.
     * @param timeAdjusted Whether the time-of-day rules apply.
     */
    public List<Double> effectiveWeights(int hour, boolean timeAdjusted) {
        List<Double> weights = new ArrayList<>(tasks.size());
        for (TaskDefinition task : tasks) {
            double weight = task.weight();
            if (timeAdjusted) {
                for (TimeWeightRule rule : rules) {
                    if (rule.appliesAt(hour) && rule.matches(task.name())) {
                        weight *= rule.getMultiplier();
                    }
                }
            }
            weights.add(weight);
        }
        return weights;
    }

    /**
     * Draws one task with probability proportional to its effective weight.
     *
     * @throws ConfigurationException if all effective weights are zero.
     */
    public TaskDefinition select(int hour, boolean timeAdjusted) {
        List<Double> weights = effectiveWeights(hour, timeAdjusted);
        double total = weights.stream().mapToDouble(Double::doubleValue).sum();
        if (!(total > 0)) {
            throw new ConfigurationException("Task weights sum to zero at hour " + hour + "; no task can be selected");
        }
        double target = random.nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < tasks.size(); i++) {
            cumulative += weights.get(i);
            if (target < cumulative) {
                return tasks.get(i);
            }
        }
        // Rounding can leave target just above the last boundary.
        for (int i = tasks.size() - 1; i >= 0; i--) {
            if (weights.get(i) > 0) {
                return tasks.get(i);
            }
        }
        throw new IllegalStateException("No task with a positive weight");
    }
}
