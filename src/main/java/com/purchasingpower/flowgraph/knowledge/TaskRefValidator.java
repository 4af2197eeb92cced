package com.purchasingpower.flowgraph.knowledge;

import com.purchasingpower.flowgraph.core.TaskRef;
import com.purchasingpower.flowgraph.exception.ConstraintViolationException;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a workflow's task list before anything is written: every reference
 * names a task and carries an order, no task appears twice, and no two tasks
 * share an order.
 */
public final class TaskRefValidator {

    private TaskRefValidator() {
    }

    public static void validate(String workflowName, List<TaskRef> tasks) {
        if (tasks == null) {
            throw new ConstraintViolationException("Task list of workflow '" + workflowName + "' is required");
        }
        Set<String> names = new HashSet<>();
        Map<Integer, String> orders = new HashMap<>();
        for (TaskRef ref : tasks) {
            if (ref == null || ref.getName() == null || ref.getName().isBlank()) {
                throw new ConstraintViolationException(
                    "Workflow '" + workflowName + "' references a task without a name");
            }
            if (ref.getOrder() == null) {
                throw new IllegalArgumentException(String.format(
                    "Task '%s' in workflow '%s' has no order", ref.getName(), workflowName));
            }
            if (!names.add(ref.getName())) {
                throw new ConstraintViolationException(String.format(
                    "Task '%s' appears more than once in workflow '%s'", ref.getName(), workflowName));
            }
            String previous = orders.putIfAbsent(ref.getOrder(), ref.getName());
            if (previous != null) {
                throw new ConstraintViolationException(String.format(
                    "Tasks '%s' and '%s' share order %d in workflow '%s'",
                    previous, ref.getName(), ref.getOrder(), workflowName));
            }
        }
    }
}
