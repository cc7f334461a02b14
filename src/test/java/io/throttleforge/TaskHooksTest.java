package io.throttleforge;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class TaskHooksTest {

    private static final TaskInfo INFO = new TaskInfo(7L, "overview", TaskContext.named("overview"), Instant.EPOCH);

    @Test
    void composedHooksRunInOrderEvenWhenTheFirstFails() {
        final List<String> calls = new CopyOnWriteArrayList<String>();
        TaskHook failing = new TaskHook() {
            @Override
            public void onQueued(TaskInfo info) {
                calls.add("first");
                throw new IllegalStateException("boom");
            }
        };
        TaskHook recording = new TaskHook() {
            @Override
            public void onQueued(TaskInfo info) {
                calls.add("second:" + info);
            }
        };

        TaskHooks.compose(failing, recording).onQueued(INFO);

        assertEquals(2, calls.size());
        assertEquals("first", calls.get(0));
        assertEquals("second:overview#7", calls.get(1));
    }

    @Test
    void guardingIsIdempotent() {
        TaskHook hook = new TaskHook() {
        };
        TaskHook guarded = TaskHooks.guarded(hook);

        assertSame(guarded, TaskHooks.guarded(guarded));
        assertSame(TaskHooks.NOOP, TaskHooks.guarded(null));
    }
}
