package io.throttleforge;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied metadata attached to a task, used for logging and correlation only.
 *
 * <p>The scheduler never looks at the content for control flow. While the task's operation
 * runs, the name and attributes are visible in the SLF4J {@link MDC} of the consumer thread
 * ({@code task} plus one entry per attribute), and the thread's previous MDC is restored afterwards.
 */
public final class TaskContext {

    /** MDC key carrying the task name. */
    public static final String MDC_TASK_KEY = "task";

    private static final TaskContext EMPTY = new TaskContext(null, Collections.<String, String>emptyMap());

    private final String name;
    private final Map<String, String> attributes;

    private TaskContext(String name, Map<String, String> attributes) {
        this.name = name;
        this.attributes = attributes;
    }

    public static TaskContext empty() {
        return EMPTY;
    }

    public static TaskContext named(String name) {
        Objects.requireNonNull(name, "name");
        return new TaskContext(name, Collections.<String, String>emptyMap());
    }

    /**
     * Returns a copy with one more attribute. A {@code null} value removes the key.
     */
    public TaskContext with(String key, String value) {
        Objects.requireNonNull(key, "key");
        Map<String, String> copy = new LinkedHashMap<String, String>(attributes);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new TaskContext(name, Collections.unmodifiableMap(copy));
    }

    /**
     * Task name, or {@code null} when the caller did not give one.
     */
    public String name() {
        return name;
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public boolean isEmpty() {
        return name == null && attributes.isEmpty();
    }

    /**
     * Installs this context into the current thread's MDC.
     *
     * @return the MDC content before installation, to hand back to {@link #restore(Map)}.
     */
    Map<String, String> install(String fallbackName) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            MDC.put(entry.getKey(), entry.getValue());
        }
        MDC.put(MDC_TASK_KEY, name == null ? fallbackName : name);
        return previous;
    }

    static void restore(Map<String, String> previous) {
        if (previous == null || previous.isEmpty()) {
            MDC.clear();
            return;
        }
        MDC.setContextMap(previous);
    }

    @Override
    public String toString() {
        return "TaskContext{name=" + name + ", attributes=" + attributes + "}";
    }
}
