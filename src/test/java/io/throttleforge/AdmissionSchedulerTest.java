package io.throttleforge;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdmissionSchedulerTest {

    private static final long START = 1_000_000L;
    private static final Duration WAIT = Duration.ofSeconds(5);

    private static AdmissionScheduler openVirtual(SchedulerConfig config, VirtualTimeSource time) {
        return AdmissionScheduler.open(config).withTimeSource(time);
    }

    private static void awaitIdle(AdmissionScheduler scheduler) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (scheduler.isConsuming()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("consumer loop still running");
            }
            Thread.sleep(5L);
        }
    }

    /**
     * Virtual clock whose next sleep fails once with a prepared error.
     */
    private static final class FaultyTimeSource implements TimeSource {
        private final VirtualTimeSource delegate = new VirtualTimeSource(START);
        private final AtomicReference<Exception> nextFault = new AtomicReference<Exception>();

        void failNextSleep(Exception fault) {
            nextFault.set(fault);
        }

        @Override
        public long currentTimeMillis() {
            return delegate.currentTimeMillis();
        }

        @Override
        public void sleep(long millis, CancellationToken token) throws InterruptedException {
            Exception fault = nextFault.getAndSet(null);
            if (fault instanceof InterruptedException) {
                throw (InterruptedException) fault;
            }
            if (fault instanceof RuntimeException) {
                throw (RuntimeException) fault;
            }
            delegate.sleep(millis, token);
        }
    }

    private static Operation<String> blockingUntil(final CountDownLatch started, final CountDownLatch release, final String value) {
        return new Operation<String>() {
            @Override
            public String run(CancellationToken token) throws InterruptedException {
                started.countDown();
                release.await();
                return value;
            }
        };
    }

    @Test
    void quotaAndSpacingAreEnforcedAcrossWindows() {
        VirtualTimeSource time = new VirtualTimeSource(START);
        final List<Long> admittedAt = new CopyOnWriteArrayList<Long>();
        final List<Long> admittedIds = new CopyOnWriteArrayList<Long>();

        try (AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time)
            .withHook(new TaskHook() {
                @Override
                public void onAdmitted(TaskInfo info, long admittedAtMillis) {
                    admittedAt.add(admittedAtMillis);
                    admittedIds.add(info.taskId());
                }
            })) {

            List<Task<Integer>> tasks = new ArrayList<Task<Integer>>();
            for (int i = 0; i < 20; i++) {
                final int section = i;
                tasks.add(scheduler.submit(new Callable<Integer>() {
                    @Override
                    public Integer call() {
                        return section;
                    }
                }));
            }
            for (int i = 0; i < 20; i++) {
                assertEquals(Integer.valueOf(i), tasks.get(i).await(WAIT));
            }

            assertEquals(20, admittedAt.size());
            for (int i = 1; i < 20; i++) {
                assertTrue(admittedIds.get(i) > admittedIds.get(i - 1), "admission order");
                assertTrue(admittedAt.get(i) - admittedAt.get(i - 1) >= 2000L, "spacing before admission " + i);
            }
            assertEquals(Long.valueOf(START), admittedAt.get(0));
            assertEquals(Long.valueOf(START + 28000L), admittedAt.get(14));
            assertTrue(admittedAt.get(15) >= START + 60000L, "16th call must wait for the next window");
            for (int i = 0; i < 20; i++) {
                int inWindow = 0;
                for (Long other : admittedAt) {
                    if (other >= admittedAt.get(i) && other < admittedAt.get(i) + 60000L) {
                        inWindow++;
                    }
                }
                assertTrue(inWindow <= 15, "window starting at admission " + i + " holds " + inWindow);
            }
        }
    }

    @Test
    void tasksRunOneAtATimeInSubmissionOrderIncludingRetries() {
        VirtualTimeSource time = new VirtualTimeSource(START);
        SchedulerConfig config = SchedulerConfig.builder().jitterCeiling(Duration.ZERO).build();
        final List<String> calls = new CopyOnWriteArrayList<String>();
        final AtomicInteger running = new AtomicInteger();
        final AtomicBoolean overlapped = new AtomicBoolean(false);
        final AtomicInteger flakyCalls = new AtomicInteger();

        try (AdmissionScheduler scheduler = openVirtual(config, time)) {
            Task<String> flaky = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    if (running.incrementAndGet() > 1) {
                        overlapped.set(true);
                    }
                    try {
                        int call = flakyCalls.incrementAndGet();
                        calls.add("A" + call);
                        if (call < 3) {
                            throw new IllegalStateException("503 Service Unavailable");
                        }
                        return "A";
                    } finally {
                        running.decrementAndGet();
                    }
                }
            });
            Task<String> steady = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    if (running.incrementAndGet() > 1) {
                        overlapped.set(true);
                    }
                    calls.add("B1");
                    running.decrementAndGet();
                    return "B";
                }
            });

            assertEquals("A", flaky.await(WAIT));
            assertEquals("B", steady.await(WAIT));
            assertEquals(3, flaky.attempts());
            assertEquals(1, steady.attempts());
            assertFalse(overlapped.get());

            List<String> expected = new ArrayList<String>();
            expected.add("A1");
            expected.add("A2");
            expected.add("A3");
            expected.add("B1");
            assertEquals(expected, calls);
            assertEquals(Long.valueOf(1000L), time.sleeps().get(0));
            assertEquals(Long.valueOf(2000L), time.sleeps().get(1));
        }
    }

    @Test
    void failuresReachTheirCallerWithoutStoppingTheLoop() {
        VirtualTimeSource time = new VirtualTimeSource(START);
        final AtomicInteger rateLimitedCalls = new AtomicInteger();

        try (AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time)) {
            Task<String> invalid = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    throw new IllegalArgumentException("Invalid request: missing field");
                }
            });
            Task<String> throttled = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    rateLimitedCalls.incrementAndGet();
                    throw new IllegalStateException("429 rate limit");
                }
            });
            Task<String> fine = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    return "ok";
                }
            });

            IllegalArgumentException invalidFailure = assertThrows(IllegalArgumentException.class, () -> invalid.await(WAIT));
            assertEquals("Invalid request: missing field", invalidFailure.getMessage());
            assertEquals(1, invalid.attempts());
            assertEquals(Task.State.FAILED, invalid.state());

            RetriesExhaustedException exhausted = assertThrows(RetriesExhaustedException.class, () -> throttled.await(WAIT));
            assertTrue(exhausted.getMessage().contains("429 rate limit"));
            assertEquals(5, rateLimitedCalls.get());
            assertEquals(5, throttled.attempts());

            assertEquals("ok", fine.await(WAIT));
        }
    }

    @Test
    void checkedFailuresAreWrappedForAwait() {
        VirtualTimeSource time = new VirtualTimeSource(START);

        try (AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time)) {
            Task<String> task = scheduler.submit(new Callable<String>() {
                @Override
                public String call() throws IOException {
                    throw new IOException("400 Bad Request");
                }
            }, TaskContext.named("summary"));

            TaskExecutionException wrapped = assertThrows(TaskExecutionException.class, () -> task.await(WAIT));
            assertTrue(wrapped.getCause() instanceof IOException);
            assertTrue(task.toCompletableFuture().isCompletedExceptionally());
        }
    }

    @Test
    void consumerStopsWhenDrainedAndRestartsOnNextSubmit() throws Exception {
        VirtualTimeSource time = new VirtualTimeSource(START);
        final List<Long> admittedAt = new CopyOnWriteArrayList<Long>();

        try (AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time)
            .withHook(new TaskHook() {
                @Override
                public void onAdmitted(TaskInfo info, long admittedAtMillis) {
                    admittedAt.add(admittedAtMillis);
                }
            })) {
            assertFalse(scheduler.isConsuming());

            assertEquals("first", scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    return "first";
                }
            }).await(WAIT));
            awaitIdle(scheduler);
            assertEquals(0, scheduler.queueDepth());

            assertEquals("second", scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    return "second";
                }
            }).await(WAIT));

            assertEquals(2, admittedAt.size());
            assertTrue(admittedAt.get(1) - admittedAt.get(0) >= 2000L);
        }
    }

    @Test
    void cancellingAQueuedTaskRemovesItWithoutRunningIt() throws Exception {
        VirtualTimeSource time = new VirtualTimeSource(START);
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicBoolean ran = new AtomicBoolean(false);
        final List<String> cancelledNames = new CopyOnWriteArrayList<String>();

        try (AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time)
            .withHook(new TaskHook() {
                @Override
                public void onCancel(TaskInfo info) {
                    cancelledNames.add(info.name());
                }
            })) {
            Task<String> running = scheduler.submit(blockingUntil(started, release, "done"));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            Task<String> queued = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    ran.set(true);
                    return "never";
                }
            }, TaskContext.named("appendix"));
            assertEquals(1, scheduler.queueDepth());

            assertTrue(queued.cancel());
            assertFalse(queued.cancel());
            assertEquals(Task.State.CANCELLED, queued.state());
            assertEquals(0, scheduler.queueDepth());
            assertThrows(CancelledException.class, () -> queued.await(WAIT));

            release.countDown();
            assertEquals("done", running.await(WAIT));
            awaitIdle(scheduler);

            assertFalse(ran.get());
            assertEquals(0, queued.attempts());
            assertEquals(1, cancelledNames.size());
            assertEquals("appendix", cancelledNames.get(0));
            assertEquals(1L, scheduler.metrics().admitted());
            assertEquals(1L, scheduler.metrics().cancelled());
        }
    }

    @Test
    void cancellingARunningTaskStopsFurtherRetries() throws Exception {
        VirtualTimeSource time = new VirtualTimeSource(START);
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger calls = new AtomicInteger();

        try (AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time)) {
            Task<String> task = scheduler.submit(new Operation<String>() {
                @Override
                public String run(CancellationToken token) throws InterruptedException {
                    calls.incrementAndGet();
                    started.countDown();
                    release.await();
                    throw DownstreamException.transientFailure("gateway hiccup");
                }
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertTrue(task.cancel());
            assertEquals(Task.State.CANCELLED, task.state());
            release.countDown();

            Task<String> next = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    return "next";
                }
            });
            assertEquals("next", next.await(WAIT));

            assertEquals(1, calls.get());
            assertEquals(1, task.attempts());
            assertThrows(CancelledException.class, () -> task.await(WAIT));
        }
    }

    @Test
    void closeCancelsQueuedTasksAndRejectsNewOnes() throws Exception {
        VirtualTimeSource time = new VirtualTimeSource(START);
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time);
        Task<String> running = scheduler.submit(blockingUntil(started, release, "unused"));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        Task<String> second = scheduler.submit(new Callable<String>() {
            @Override
            public String call() {
                return "second";
            }
        });
        Task<String> third = scheduler.submit(new Callable<String>() {
            @Override
            public String call() {
                return "third";
            }
        });

        scheduler.close();
        scheduler.close();

        assertTrue(scheduler.isClosed());
        assertEquals(0, scheduler.queueDepth());
        assertThrows(CancelledException.class, () -> second.await(WAIT));
        assertThrows(CancelledException.class, () -> third.await(WAIT));
        assertThrows(CancelledException.class, () -> running.await(WAIT));
        assertEquals(Task.State.CANCELLED, second.state());
        assertEquals(0, second.attempts());

        assertThrows(IllegalStateException.class, () -> scheduler.submit(new Callable<String>() {
            @Override
            public String call() {
                return "late";
            }
        }));
    }

    @Test
    void fullQueueRejectsWithRejectPolicy() throws Exception {
        VirtualTimeSource time = new VirtualTimeSource(START);
        SchedulerConfig config = SchedulerConfig.builder().queueCapacity(2).build();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        Callable<String> quick = new Callable<String>() {
            @Override
            public String call() {
                return "quick";
            }
        };

        try (AdmissionScheduler scheduler = openVirtual(config, time)) {
            Task<String> running = scheduler.submit(blockingUntil(started, release, "slow"));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Task<String> second = scheduler.submit(quick);
            Task<String> third = scheduler.submit(quick);

            QueueFullException full = assertThrows(QueueFullException.class, () -> scheduler.submit(quick));
            assertEquals(2, full.capacity());
            assertEquals(2, scheduler.queueDepth());
            assertEquals(1L, scheduler.metrics().rejected());

            release.countDown();
            assertEquals("slow", running.await(WAIT));
            assertEquals("quick", second.await(WAIT));
            assertEquals("quick", third.await(WAIT));
        }
    }

    @Test
    void fullQueueBlocksSubmitterWithBlockPolicy() throws Exception {
        VirtualTimeSource time = new VirtualTimeSource(START);
        SchedulerConfig config = SchedulerConfig.builder()
            .queueCapacity(1)
            .overflowPolicy(OverflowPolicy.BLOCK)
            .build();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        ExecutorService submitter = Executors.newSingleThreadExecutor();

        try (final AdmissionScheduler scheduler = openVirtual(config, time)) {
            Task<String> running = scheduler.submit(blockingUntil(started, release, "slow"));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Task<String> second = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    return "second";
                }
            });

            Future<Task<String>> blocked = submitter.submit(new Callable<Task<String>>() {
                @Override
                public Task<String> call() {
                    return scheduler.submit(new Callable<String>() {
                        @Override
                        public String call() {
                            return "third";
                        }
                    });
                }
            });
            assertThrows(TimeoutException.class, () -> blocked.get(300, TimeUnit.MILLISECONDS));

            release.countDown();
            Task<String> third = blocked.get(5, TimeUnit.SECONDS);
            assertEquals("slow", running.await(WAIT));
            assertEquals("second", second.await(WAIT));
            assertEquals("third", third.await(WAIT));
            assertEquals(0L, scheduler.metrics().rejected());
        } finally {
            submitter.shutdownNow();
        }
    }

    @Test
    void taskContextIsVisibleThroughMdcDuringExecution() {
        VirtualTimeSource time = new VirtualTimeSource(START);
        final AtomicReference<String> taskKey = new AtomicReference<String>();
        final AtomicReference<String> sectionKey = new AtomicReference<String>();
        final AtomicReference<String> leakedSection = new AtomicReference<String>("unset");
        final AtomicReference<String> anonymousTaskKey = new AtomicReference<String>();

        try (AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time)) {
            Task<String> named = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    taskKey.set(MDC.get(TaskContext.MDC_TASK_KEY));
                    sectionKey.set(MDC.get("section"));
                    return "risks";
                }
            }, TaskContext.named("risks").with("section", "7"));
            Task<String> anonymous = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    leakedSection.set(MDC.get("section"));
                    anonymousTaskKey.set(MDC.get(TaskContext.MDC_TASK_KEY));
                    return "anonymous";
                }
            });

            assertEquals("risks", named.await(WAIT));
            assertEquals("anonymous", anonymous.await(WAIT));
        }

        assertEquals("risks", taskKey.get());
        assertEquals("7", sectionKey.get());
        assertNull(leakedSection.get());
        assertTrue(anonymousTaskKey.get().startsWith("task-"));
    }

    @Test
    void configurationIsLockedAfterFirstSubmission() {
        VirtualTimeSource time = new VirtualTimeSource(START);

        try (AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time)) {
            scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    return "x";
                }
            }).await(WAIT);

            assertThrows(IllegalStateException.class, () -> scheduler.withHook(new TaskHook() {
            }));
            assertThrows(IllegalStateException.class, () -> scheduler.withTimeSource(TimeSource.system()));
            assertThrows(IllegalStateException.class, () -> scheduler.withDispatcher(Dispatcher.dedicated()));
        }
    }

    @Test
    void failingHooksDoNotDisturbScheduling() {
        VirtualTimeSource time = new VirtualTimeSource(START);
        TaskHook broken = new TaskHook() {
            @Override
            public void onQueued(TaskInfo info) {
                throw new IllegalStateException("queued hook broken");
            }

            @Override
            public void onAdmitted(TaskInfo info, long admittedAtMillis) {
                throw new IllegalStateException("admitted hook broken");
            }

            @Override
            public void onSuccess(TaskInfo info, int attempts, Duration duration) {
                throw new IllegalStateException("success hook broken");
            }
        };

        try (AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time).withHook(broken)) {
            Task<String> task = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    return "still fine";
                }
            });
            assertEquals("still fine", task.await(WAIT));
            assertEquals(Task.State.SUCCESS, task.state());
        }
    }

    @Test
    void hooksAndMetricsObserveTheWholeLifecycle() throws Exception {
        VirtualTimeSource time = new VirtualTimeSource(START);
        SchedulerConfig config = SchedulerConfig.builder().jitterCeiling(Duration.ZERO).build();
        final List<String> events = new CopyOnWriteArrayList<String>();
        final AtomicInteger flakyCalls = new AtomicInteger();

        try (AdmissionScheduler scheduler = openVirtual(config, time).withHook(new TaskHook() {
            @Override
            public void onQueued(TaskInfo info) {
                events.add("queued:" + info.name());
            }

            @Override
            public void onAdmitted(TaskInfo info, long admittedAtMillis) {
                events.add("admitted:" + info.name());
            }

            @Override
            public void onRetry(TaskInfo info, int attempt, ErrorKind kind, Throwable error, Duration delay) {
                events.add("retry:" + info.name() + ":" + attempt + ":" + kind + ":" + delay.toMillis());
            }

            @Override
            public void onSuccess(TaskInfo info, int attempts, Duration duration) {
                events.add("success:" + info.name() + ":" + attempts);
            }

            @Override
            public void onFailure(TaskInfo info, Throwable error, int attempts, Duration duration) {
                events.add("failure:" + info.name() + ":" + attempts);
            }
        })) {
            Task<String> flaky = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    if (flakyCalls.incrementAndGet() == 1) {
                        throw DownstreamException.rateLimited("Too Many Requests");
                    }
                    return "ok";
                }
            }, TaskContext.named("flaky"));
            Task<String> broken = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    throw DownstreamException.permanent("Invalid API key");
                }
            }, TaskContext.named("broken"));

            assertEquals("ok", flaky.await(WAIT));
            assertThrows(DownstreamException.class, () -> broken.await(WAIT));
            awaitIdle(scheduler);

            assertTrue(events.contains("queued:flaky"));
            assertTrue(events.contains("queued:broken"));
            assertTrue(events.indexOf("admitted:flaky") < events.indexOf("retry:flaky:1:RATE_LIMITED:10000"));
            assertTrue(events.indexOf("retry:flaky:1:RATE_LIMITED:10000") < events.indexOf("success:flaky:2"));
            assertTrue(events.indexOf("success:flaky:2") < events.indexOf("admitted:broken"));
            assertTrue(events.contains("failure:broken:1"));

            SchedulerMetricsSnapshot metrics = scheduler.metrics();
            assertEquals(2L, metrics.submitted());
            assertEquals(2L, metrics.admitted());
            assertEquals(1L, metrics.succeeded());
            assertEquals(1L, metrics.failed());
            assertEquals(1L, metrics.retries());
            assertEquals(2L, metrics.completed());
            assertTrue(metrics.windowWaits() >= 1L);
        }
    }

    @Test
    void externalDispatcherIsLeftRunningOnClose() {
        VirtualTimeSource time = new VirtualTimeSource(START);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        Dispatcher dispatcher = Dispatcher.from(pool);

        try {
            AdmissionScheduler scheduler = openVirtual(SchedulerConfig.defaults(), time).withDispatcher(dispatcher);
            assertSame(dispatcher, scheduler.dispatcher());
            assertFalse(dispatcher.ownsExecutor());
            assertEquals("pooled", scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    return "pooled";
                }
            }).await(WAIT));
            scheduler.close();

            assertFalse(pool.isShutdown());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void operationThrowingInterruptedExceptionDoesNotStrandLaterTasks() throws Exception {
        SchedulerConfig config = SchedulerConfig.builder().minInterval(Duration.ofMillis(50)).build();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        try (AdmissionScheduler scheduler = AdmissionScheduler.open(config)) {
            Task<String> interrupted = scheduler.submit(new Operation<String>() {
                @Override
                public String run(CancellationToken token) throws InterruptedException {
                    started.countDown();
                    release.await();
                    throw new InterruptedException("client gave up");
                }
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Task<String> next = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    return "next";
                }
            });
            release.countDown();

            assertThrows(CancelledException.class, () -> interrupted.await(WAIT));
            assertEquals("next", next.await(WAIT));
            awaitIdle(scheduler);
            assertEquals(0, scheduler.queueDepth());
        }
    }

    @Test
    void interruptFlagLeftByAnOperationIsCleared() throws Exception {
        SchedulerConfig config = SchedulerConfig.builder().minInterval(Duration.ofMillis(50)).build();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        try (AdmissionScheduler scheduler = AdmissionScheduler.open(config)) {
            Task<String> aborted = scheduler.submit(new Operation<String>() {
                @Override
                public String run(CancellationToken token) throws InterruptedException {
                    started.countDown();
                    release.await();
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("aborted by client");
                }
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Task<String> next = scheduler.submit(new Callable<String>() {
                @Override
                public String call() {
                    return "next";
                }
            });
            release.countDown();

            assertThrows(IllegalStateException.class, () -> aborted.await(WAIT));
            assertEquals("next", next.await(WAIT));
        }
    }

    @Test
    void failingTimeSourceFailsOnlyTheHeadTask() throws Exception {
        final FaultyTimeSource time = new FaultyTimeSource();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        Callable<String> quick = new Callable<String>() {
            @Override
            public String call() {
                return "quick";
            }
        };

        try (AdmissionScheduler scheduler = AdmissionScheduler.open(SchedulerConfig.defaults()).withTimeSource(time)) {
            Task<String> first = scheduler.submit(blockingUntil(started, release, "first"));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Task<String> second = scheduler.submit(quick);
            Task<String> third = scheduler.submit(quick);
            time.failNextSleep(new IllegalStateException("clock unavailable"));
            release.countDown();

            assertEquals("first", first.await(WAIT));
            IllegalStateException failure = assertThrows(IllegalStateException.class, () -> second.await(WAIT));
            assertEquals("clock unavailable", failure.getMessage());
            assertEquals(0, second.attempts());
            assertEquals("quick", third.await(WAIT));

            awaitIdle(scheduler);
            assertEquals("quick", scheduler.submit(quick).await(WAIT));
        }
    }

    @Test
    void loopInterruptedWhileWaitingRestartsForQueuedTasks() throws Exception {
        final FaultyTimeSource time = new FaultyTimeSource();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        Callable<String> quick = new Callable<String>() {
            @Override
            public String call() {
                return "quick";
            }
        };

        try (AdmissionScheduler scheduler = AdmissionScheduler.open(SchedulerConfig.defaults()).withTimeSource(time)) {
            Task<String> first = scheduler.submit(blockingUntil(started, release, "first"));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Task<String> second = scheduler.submit(quick);
            time.failNextSleep(new InterruptedException("consumer interrupted"));
            release.countDown();

            assertEquals("first", first.await(WAIT));
            assertEquals("quick", second.await(WAIT));
            assertEquals(1, second.attempts());
            awaitIdle(scheduler);
        }
    }
}
