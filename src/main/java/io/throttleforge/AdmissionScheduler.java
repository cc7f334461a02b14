package io.throttleforge;

import io.throttleforge.internal.DefaultCancellationToken;
import io.throttleforge.internal.SchedulerMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 面向限额下游服务的准入调度器。
 *
 * <p>所有对下游（例如文本生成接口）的调用都经由同一个 {@code AdmissionScheduler} 排队：
 * 任务按提交顺序先进先出，由唯一的消费循环逐个准入，保证
 * 每个配额窗口内的准入数不超过 {@code maxPerPeriod}、相邻两次准入间隔不小于 {@code minInterval}，
 * 并对可重试错误按指数退避 + 抖动重试。
 *
 * <p>线程安全约束：
 * 配置方法（{@code with*}）只能在第一次提交前调用；
 * {@code submit} 支持任意线程并发调用，只做入队，必要时启动消费循环；
 * 配额窗口只由消费循环读写，不需要额外加锁。
 *
 * <p>执行是严格串行的：同一调度器内不会有两个操作同时运行，完成顺序等于准入顺序。
 *
 * <p>推荐用法示例：
 * <pre>{@code
 * try (AdmissionScheduler scheduler = AdmissionScheduler.open(SchedulerConfig.load("throttleforge.properties"))) {
 *     Task<String> intro = scheduler.submit(() -> client.generate(introPrompt), TaskContext.named("intro"));
 *     Task<String> scope = scheduler.submit(() -> client.generate(scopePrompt), TaskContext.named("scope"));
 *     render(intro.await(), scope.await());
 * }
 * }</pre>
 */
public final class AdmissionScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionScheduler.class);

    private static final AtomicLong SCHEDULER_IDS = new AtomicLong(1L);
    private static final long SPACE_POLL_MILLIS = 100L;

    private final long schedulerId;
    private final SchedulerConfig config;
    private final AtomicLong taskIdGen;
    private final AtomicBoolean closed;
    private final AtomicBoolean configLocked;
    private final DefaultCancellationToken token;
    private final SchedulerMetrics metrics;
    private final Task.CancelListener cancelListener;

    private final ReentrantLock lock;
    private final Condition notFull;
    private final ArrayDeque<Task<?>> queue;
    private boolean consuming;

    private volatile TimeSource timeSource;
    private volatile TaskHook hook;
    private volatile Dispatcher dispatcher;
    private volatile AdmissionWindow window;

    /**
     * 私有构造函数，统一设置默认配置和内部基础设施。
     *
     * <p>默认值：
     * {@code timeSource=TimeSource.system()}，
     * {@code dispatcher=Dispatcher.dedicated()}，
     * 无 hook。
     */
    private AdmissionScheduler(SchedulerConfig config) {
        this.schedulerId = SCHEDULER_IDS.getAndIncrement();
        this.config = config;
        this.taskIdGen = new AtomicLong(1L);
        this.closed = new AtomicBoolean(false);
        this.configLocked = new AtomicBoolean(false);
        this.token = new DefaultCancellationToken("Scheduler closed");
        this.metrics = new SchedulerMetrics();
        this.lock = new ReentrantLock();
        this.notFull = lock.newCondition();
        this.queue = new ArrayDeque<Task<?>>();
        this.consuming = false;
        this.timeSource = TimeSource.system();
        this.hook = TaskHooks.NOOP;
        this.dispatcher = Dispatcher.dedicated();
        this.window = newWindow(timeSource);
        this.cancelListener = new Task.CancelListener() {
            @Override
            public void onCancelled(Task<?> task) {
                handleCancelled(task);
            }
        };
    }

    /**
     * 使用默认配置创建调度器：每 60 秒 15 次、间隔 2 秒、最多 5 次尝试。
     */
    public static AdmissionScheduler open() {
        return open(SchedulerConfig.defaults());
    }

    /**
     * 使用给定配置创建调度器。每次调用返回全新实例，互不共享队列与配额窗口。
     */
    public static AdmissionScheduler open(SchedulerConfig config) {
        Objects.requireNonNull(config, "config");
        AdmissionScheduler scheduler = new AdmissionScheduler(config);
        log.debug("Opened admission scheduler {} with {}", scheduler.schedulerId, config);
        return scheduler;
    }

    /**
     * 指定时钟与休眠实现（测试中注入虚拟时钟）。
     *
     * <p>配额窗口以新时钟的当前时间重新开始。
     */
    public AdmissionScheduler withTimeSource(TimeSource timeSource) {
        Objects.requireNonNull(timeSource, "timeSource");
        ensureConfigurable();
        this.timeSource = timeSource;
        this.window = newWindow(timeSource);
        return this;
    }

    /**
     * 设置任务生命周期回调，适合桥接外部日志、指标系统。
     *
     * <p>hook 抛出的异常只会被记录，不影响调度。
     */
    public AdmissionScheduler withHook(TaskHook hook) {
        Objects.requireNonNull(hook, "hook");
        ensureConfigurable();
        this.hook = TaskHooks.guarded(hook);
        return this;
    }

    /**
     * 指定运行消费循环的线程来源。被替换的默认分发器会立即关闭。
     */
    public AdmissionScheduler withDispatcher(Dispatcher dispatcher) {
        Objects.requireNonNull(dispatcher, "dispatcher");
        ensureConfigurable();
        Dispatcher previous = this.dispatcher;
        this.dispatcher = dispatcher;
        if (previous != dispatcher) {
            previous.shutdownIfOwned();
        }
        return this;
    }

    public SchedulerConfig config() {
        return config;
    }

    public TimeSource timeSource() {
        return timeSource;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * 内置运行时指标快照，不阻塞消费循环。
     */
    public SchedulerMetricsSnapshot metrics() {
        return metrics.snapshot();
    }

    /**
     * 当前排队（尚未准入）的任务数。
     */
    public int queueDepth() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 消费循环是否处于活动状态。
     */
    public boolean isConsuming() {
        lock.lock();
        try {
            return consuming;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 提交匿名任务，任务名自动生成为 {@code task-<id>}。
     */
    public <T> Task<T> submit(Callable<T> operation) {
        return submit(adapt(operation), TaskContext.empty());
    }

    /**
     * 提交带上下文的任务。
     *
     * <p>示例：
     * <pre>{@code
     * Task<String> t = scheduler.submit(() -> client.generate(prompt),
     *     TaskContext.named("risks").with("section", "7"));
     * }</pre>
     */
    public <T> Task<T> submit(Callable<T> operation, TaskContext context) {
        return submit(adapt(operation), context);
    }

    /**
     * 提交可感知取消的匿名任务。
     */
    public <T> Task<T> submit(Operation<T> operation) {
        return submit(operation, TaskContext.empty());
    }

    /**
     * 提交可感知取消的任务。操作会收到任务自身的取消令牌。
     *
     * <p>立即返回任务句柄；队列已满时按 {@link OverflowPolicy} 拒绝或阻塞。
     *
     * @throws QueueFullException 队列已满且策略为 {@link OverflowPolicy#REJECT}
     * @throws CancelledException 阻塞等待队列空间期间调度器被关闭或线程被中断
     * @throws IllegalStateException 调度器已关闭
     */
    public <T> Task<T> submit(Operation<T> operation, TaskContext context) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(context, "context");
        lockConfiguration();
        ensureOpen();

        Task<T> task;
        boolean startLoop;
        int depth;
        lock.lock();
        try {
            while (queue.size() >= config.queueCapacity()) {
                if (config.overflowPolicy() == OverflowPolicy.REJECT) {
                    metrics.recordRejected();
                    throw new QueueFullException(config.queueCapacity());
                }
                awaitSpace();
            }
            ensureOpen();

            long id = taskIdGen.getAndIncrement();
            String name = context.name() == null ? "task-" + id : context.name();
            Instant createdAt = Instant.ofEpochMilli(timeSource.currentTimeMillis());
            task = new Task<T>(id, name, context, createdAt, operation, token, cancelListener);
            queue.addLast(task);
            depth = queue.size();

            startLoop = !consuming;
            if (startLoop) {
                consuming = true;
            }
        } finally {
            lock.unlock();
        }

        metrics.recordSubmitted();
        log.debug("Queued {} (queue depth {})", task.name(), depth);
        hook.onQueued(task.info());

        if (startLoop) {
            startConsumer();
        }
        return task;
    }

    /**
     * 关闭调度器：
     * 1) 拒绝后续提交；
     * 2) 以 {@link CancelledException} 结束所有排队中的任务；
     * 3) 中止配额/间隔/退避等待，运行中的任务不再重试；
     * 4) 关闭调度器持有的分发器。
     *
     * <p>该方法幂等，重复调用安全。
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        token.cancel();

        List<Task<?>> pending;
        lock.lock();
        try {
            pending = new ArrayList<Task<?>>(queue);
            queue.clear();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }

        for (Task<?> task : pending) {
            if (task.completeCancelled(new CancelledException("Scheduler closed before " + task.name() + " was admitted"))) {
                metrics.recordCancelled();
                hook.onCancel(task.info());
            }
        }

        dispatcher.shutdownIfOwned();
        log.info("Closed admission scheduler {}, {} queued task(s) cancelled", schedulerId, pending.size());
    }

    /**
     * 把消费循环交给分发器；分发器拒绝时，所有排队任务以拒绝异常结束。
     */
    private void startConsumer() {
        try {
            dispatcher.execute(new Runnable() {
                @Override
                public void run() {
                    consume();
                }
            });
        } catch (RejectedExecutionException rejected) {
            List<Task<?>> stranded;
            lock.lock();
            try {
                consuming = false;
                stranded = new ArrayList<Task<?>>(queue);
                queue.clear();
                notFull.signalAll();
            } finally {
                lock.unlock();
            }
            log.error("Dispatcher {} rejected the consumer loop, failing {} queued task(s)", dispatcher.name(), stranded.size(), rejected);
            for (Task<?> task : stranded) {
                if (task.completeFailure(rejected)) {
                    metrics.recordFailure(0L);
                    hook.onFailure(task.info(), rejected, 0, Duration.ZERO);
                }
            }
        }
    }

    /**
     * 消费循环入口。循环异常退出时（等待被中断、时钟抛出错误等）统一交给 {@link #handOff()}，
     * 保证调度器未关闭且仍有排队任务时不会出现无人消费的队列。
     */
    private void consume() {
        log.debug("Consumer loop started for scheduler {}", schedulerId);
        boolean drained = false;
        try {
            drained = drainQueue();
        } finally {
            if (!drained) {
                handOff();
            }
        }
    }

    /**
     * 队列非空时反复执行“等待准入 → 出队 → 带重试执行 → 记账 → 完成结果槽”。
     *
     * @return 队列排空（已清除运行标记）时返回 true；等待被中断或调度器关闭时返回 false
     */
    private boolean drainQueue() {
        while (true) {
            lock.lock();
            try {
                if (!hasLiveHead()) {
                    consuming = false;
                    log.debug("Consumer loop drained for scheduler {}", schedulerId);
                    return true;
                }
            } finally {
                lock.unlock();
            }

            try {
                if (window.awaitAdmission(token)) {
                    metrics.recordWindowWait();
                }
            } catch (InterruptedException interruptedException) {
                Thread.currentThread().interrupt();
                log.debug("Consumer loop for scheduler {} interrupted while waiting for admission", schedulerId);
                return false;
            } catch (CancelledException cancelledException) {
                log.debug("Consumer loop for scheduler {} cancelled while waiting for admission", schedulerId);
                return false;
            } catch (RuntimeException failure) {
                failHead(failure);
                continue;
            }

            Task<?> task;
            lock.lock();
            try {
                task = queue.pollFirst();
                if (task != null) {
                    notFull.signal();
                }
            } finally {
                lock.unlock();
            }

            if (task != null) {
                runTask(task);
                // operations that restore the interrupt flag before failing must not stop the loop
                if (!closed.get() && Thread.interrupted()) {
                    log.debug("Cleared interrupt left by {}", task.name());
                }
            }
        }
    }

    /**
     * 准入等待本身失败时，以该错误结束队首任务，循环继续处理后续任务。
     */
    private void failHead(RuntimeException failure) {
        Task<?> task;
        lock.lock();
        try {
            task = queue.pollFirst();
            if (task != null) {
                notFull.signal();
            }
        } finally {
            lock.unlock();
        }
        if (task == null) {
            return;
        }
        log.error("Admission wait failed for {}: {}", task.name(), failure.getMessage(), failure);
        if (task.completeFailure(failure)) {
            metrics.recordFailure(0L);
            hook.onFailure(task.info(), failure, 0, Duration.ZERO);
        }
    }

    /**
     * 消费循环非正常退出后的交接：调度器未关闭且仍有排队任务时重新启动消费循环，否则清除运行标记。
     */
    private void handOff() {
        boolean restart;
        lock.lock();
        try {
            restart = !closed.get() && hasLiveHead();
            consuming = restart;
        } finally {
            lock.unlock();
        }
        if (restart) {
            log.warn("Consumer loop for scheduler {} stopped with tasks queued, restarting", schedulerId);
            startConsumer();
        }
    }

    /**
     * 在消费线程内执行单个任务，并统一处理状态迁移、配额记账、观测打点。
     */
    private <T> void runTask(final Task<T> task) {
        if (!task.markRunning()) {
            return;
        }

        final TaskInfo info = task.info();
        metrics.recordAdmitted();
        hook.onAdmitted(info, timeSource.currentTimeMillis());

        Map<String, String> previousMdc = task.context().install(task.name());
        long started = System.nanoTime();
        try {
            T value = RetryExecutor.execute(
                task.operation(),
                config.backoffPolicy(),
                timeSource,
                task.token(),
                new RetryExecutor.AttemptObserver() {
                    @Override
                    public void onAttempt(int attempt) {
                        task.recordAttempt();
                    }

                    @Override
                    public void onRetry(int attempt, ErrorKind kind, Throwable failure, long delayMillis) {
                        metrics.recordRetry();
                        hook.onRetry(info, attempt, kind, failure, Duration.ofMillis(delayMillis));
                    }
                }
            );
            if (task.completeSuccess(value)) {
                long elapsed = elapsedNanos(started);
                metrics.recordSuccess(elapsed);
                log.debug("{} succeeded after {} attempt(s)", task.name(), task.attempts());
                hook.onSuccess(info, task.attempts(), Duration.ofNanos(elapsed));
            }
        } catch (InterruptedException interruptedException) {
            if (token.isCancelled()) {
                Thread.currentThread().interrupt();
            }
            completeCancelled(task, new CancelledException("Task " + task.name() + " interrupted", interruptedException));
        } catch (CancelledException cancelledException) {
            completeCancelled(task, cancelledException);
        } catch (Throwable failure) {
            if (task.completeFailure(failure)) {
                long elapsed = elapsedNanos(started);
                metrics.recordFailure(elapsed);
                log.error("{} failed after {} attempt(s): {}", task.name(), task.attempts(), failure.getMessage());
                hook.onFailure(info, failure, task.attempts(), Duration.ofNanos(elapsed));
            }
        } finally {
            if (task.attempts() > 0) {
                window.recordAdmission();
            }
            TaskContext.restore(previousMdc);
        }
    }

    private void completeCancelled(Task<?> task, CancelledException cancelledException) {
        if (task.completeCancelled(cancelledException)) {
            metrics.recordCancelled();
            log.debug("{} cancelled after {} attempt(s)", task.name(), task.attempts());
            hook.onCancel(task.info());
        }
    }

    /**
     * 任务自身令牌被取消时的回调：排队中的任务移出队列并释放队列空间。
     */
    private void handleCancelled(Task<?> task) {
        lock.lock();
        try {
            if (queue.remove(task)) {
                notFull.signal();
            }
        } finally {
            lock.unlock();
        }
        metrics.recordCancelled();
        log.debug("{} cancelled in state {}", task.name(), task.state());
        hook.onCancel(task.info());
    }

    /**
     * 丢弃队首已结束的任务（必须持有锁），返回队列是否仍有待执行任务。
     */
    private boolean hasLiveHead() {
        Iterator<Task<?>> iterator = queue.iterator();
        while (iterator.hasNext()) {
            if (!iterator.next().isDone()) {
                return true;
            }
            iterator.remove();
            notFull.signal();
        }
        return false;
    }

    /**
     * 阻塞等待队列空间（必须持有锁），周期性检查关闭信号。
     */
    private void awaitSpace() {
        token.throwIfCancelled();
        try {
            notFull.await(SPACE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted while waiting for queue space", interruptedException);
        }
        token.throwIfCancelled();
    }

    private AdmissionWindow newWindow(TimeSource source) {
        return new AdmissionWindow(
            source,
            config.period().toMillis(),
            config.maxPerPeriod(),
            config.minInterval().toMillis()
        );
    }

    private static <T> Operation<T> adapt(final Callable<T> callable) {
        Objects.requireNonNull(callable, "operation");
        return new Operation<T>() {
            @Override
            public T run(CancellationToken token) throws Exception {
                return callable.call();
            }
        };
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("AdmissionScheduler already closed");
        }
    }

    private void ensureConfigurable() {
        ensureOpen();
        if (configLocked.get()) {
            throw new IllegalStateException("AdmissionScheduler configuration is locked after first submission");
        }
    }

    private void lockConfiguration() {
        configLocked.set(true);
    }

    private long elapsedNanos(long startedAtNanos) {
        return Math.max(0L, System.nanoTime() - startedAtNanos);
    }
}
