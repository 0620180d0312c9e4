package dk.cloudcreate.essentials.components.eventsourced.deciders.workflow;

import java.time.Instant;
import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The events of a workflow. There are exactly two kinds: {@link TaskStarted} and {@link TaskCompleted}.<br>
 * Timestamps are optional and always supplied by the caller, which keeps deciders that produce these events deterministic.
 *
 * @param <T> the task name type
 */
public abstract class WorkflowEvent<T> {
    public final T                   taskName;
    private final Instant             timestamp;
    private final Map<String, Object> metadata;

    private WorkflowEvent(T taskName, Instant timestamp, Map<String, ?> metadata) {
        this.taskName = requireNonNull(taskName, "No taskName provided");
        this.timestamp = timestamp;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(metadata, "No metadata provided")));
    }

    public static <T> TaskStarted<T> taskStarted(T taskName) {
        return new TaskStarted<>(taskName, null, Map.of());
    }

    public static <T> TaskStarted<T> taskStarted(T taskName, Map<String, ?> metadata) {
        return new TaskStarted<>(taskName, null, metadata);
    }

    public static <T> TaskStarted<T> taskStarted(T taskName, Map<String, ?> metadata, Instant timestamp) {
        return new TaskStarted<>(taskName, requireNonNull(timestamp, "No timestamp provided"), metadata);
    }

    public static <T> TaskCompleted<T> taskCompleted(T taskName) {
        return new TaskCompleted<>(taskName, null, null, Map.of());
    }

    public static <T> TaskCompleted<T> taskCompleted(T taskName, Object result) {
        return new TaskCompleted<>(taskName, requireNonNull(result, "No result provided"), null, Map.of());
    }

    public static <T> TaskCompleted<T> taskCompleted(T taskName, Object result, Map<String, ?> metadata) {
        return new TaskCompleted<>(taskName, result, null, metadata);
    }

    public static <T> TaskCompleted<T> taskCompleted(T taskName, Object result, Map<String, ?> metadata, Instant timestamp) {
        return new TaskCompleted<>(taskName, result, requireNonNull(timestamp, "No timestamp provided"), metadata);
    }

    /**
     * Exhaustively fold this event into a single result
     *
     * @param ifTaskStarted   applied when this is a {@link TaskStarted}
     * @param ifTaskCompleted applied when this is a {@link TaskCompleted}
     * @param <R>             the result type
     * @return the result of the matching function
     */
    public abstract <R> R fold(Function<? super TaskStarted<T>, ? extends R> ifTaskStarted,
                               Function<? super TaskCompleted<T>, ? extends R> ifTaskCompleted);

    public T taskName() {
        return taskName;
    }

    public Optional<Instant> timestamp() {
        return Optional.ofNullable(timestamp);
    }

    /**
     * @return the (unmodifiable) metadata, e.g. data that the reaction to the event needs
     */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * A task has been started
     */
    public static final class TaskStarted<T> extends WorkflowEvent<T> {
        private TaskStarted(T taskName, Instant timestamp, Map<String, ?> metadata) {
            super(taskName, timestamp, metadata);
        }

        @Override
        public <R> R fold(Function<? super TaskStarted<T>, ? extends R> ifTaskStarted,
                          Function<? super TaskCompleted<T>, ? extends R> ifTaskCompleted) {
            requireNonNull(ifTaskStarted, "No ifTaskStarted function provided");
            return ifTaskStarted.apply(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TaskStarted)) return false;
            var that = (TaskStarted<?>) o;
            return taskName.equals(that.taskName) &&
                    timestamp().equals(that.timestamp()) &&
                    metadata().equals(that.metadata());
        }

        @Override
        public int hashCode() {
            return Objects.hash(TaskStarted.class, taskName, timestamp(), metadata());
        }

        @Override
        public String toString() {
            return "TaskStarted{" +
                    "taskName=" + taskName +
                    ", timestamp=" + timestamp() +
                    ", metadata=" + metadata() +
                    '}';
        }
    }

    /**
     * A task has been completed, optionally with a result
     */
    public static final class TaskCompleted<T> extends WorkflowEvent<T> {
        private final Object result;

        private TaskCompleted(T taskName, Object result, Instant timestamp, Map<String, ?> metadata) {
            super(taskName, timestamp, metadata);
            this.result = result;
        }

        public Optional<Object> result() {
            return Optional.ofNullable(result);
        }

        @Override
        public <R> R fold(Function<? super TaskStarted<T>, ? extends R> ifTaskStarted,
                          Function<? super TaskCompleted<T>, ? extends R> ifTaskCompleted) {
            requireNonNull(ifTaskCompleted, "No ifTaskCompleted function provided");
            return ifTaskCompleted.apply(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TaskCompleted)) return false;
            var that = (TaskCompleted<?>) o;
            return taskName.equals(that.taskName) &&
                    result().equals(that.result()) &&
                    timestamp().equals(that.timestamp()) &&
                    metadata().equals(that.metadata());
        }

        @Override
        public int hashCode() {
            return Objects.hash(TaskCompleted.class, taskName, result, timestamp(), metadata());
        }

        @Override
        public String toString() {
            return "TaskCompleted{" +
                    "taskName=" + taskName +
                    ", result=" + result +
                    ", timestamp=" + timestamp() +
                    ", metadata=" + metadata() +
                    '}';
        }
    }
}
