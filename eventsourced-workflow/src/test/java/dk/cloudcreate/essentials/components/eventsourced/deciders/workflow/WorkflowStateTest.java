package dk.cloudcreate.essentials.components.eventsourced.deciders.workflow;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WorkflowStateTest {
    @Test
    void verify_an_unknown_task_is_not_started() {
        var state = WorkflowState.<String>empty();

        assertThat(state.taskStatus("processPayment")).isEqualTo(TaskStatus.NOT_STARTED);
        assertThat(state.isTaskStarted("processPayment")).isFalse();
        assertThat(state.isTaskCompleted("processPayment")).isFalse();
        assertThat(state.tasks()).isEmpty();
    }

    @Test
    void verify_with_task_status_returns_a_new_state() {
        var empty   = WorkflowState.<String>empty();
        var started = empty.withTaskStatus("processPayment", TaskStatus.STARTED);
        var done    = started.withTaskStatus("processPayment", TaskStatus.FINISHED);

        assertThat(empty.isTaskStarted("processPayment")).isFalse();
        assertThat(started.isTaskStarted("processPayment")).isTrue();
        assertThat(started.isTaskCompleted("processPayment")).isFalse();
        assertThat(done.isTaskStarted("processPayment")).isTrue();
        assertThat(done.isTaskCompleted("processPayment")).isTrue();
    }

    @Test
    void verify_not_started_entries_are_dropped() {
        var state = WorkflowState.of(Map.of("a", TaskStatus.NOT_STARTED, "b", TaskStatus.STARTED));

        assertThat(state.tasks()).containsOnlyKeys("b");
        assertThat(state).isEqualTo(WorkflowState.<String>empty().withTaskStatus("b", TaskStatus.STARTED));
        assertThat(WorkflowState.of(Map.of("a", TaskStatus.NOT_STARTED))).isEqualTo(WorkflowState.empty());
    }

    @Test
    void verify_merge_prefers_the_other_states_status() {
        var first  = WorkflowState.of(Map.of("a", TaskStatus.STARTED, "b", TaskStatus.STARTED));
        var second = WorkflowState.of(Map.of("b", TaskStatus.FINISHED, "c", TaskStatus.STARTED));

        var merged = first.merge(second);

        assertThat(merged.tasks()).containsOnly(entry("a", TaskStatus.STARTED),
                                                entry("b", TaskStatus.FINISHED),
                                                entry("c", TaskStatus.STARTED));
    }

    @Test
    void verify_the_tasks_are_unmodifiable() {
        var state = WorkflowState.<String>empty().withTaskStatus("a", TaskStatus.STARTED);

        assertThatThrownBy(() -> state.tasks().put("b", TaskStatus.STARTED))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
