package io.throttleforge;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 消费循环的线程来源。
 *
 * <p>{@code Dispatcher} 封装了运行消费循环的 {@link ExecutorService} 及其生命周期归属。
 * 调度器同一时刻只会提交一个消费循环，因此一个线程即可满足需要；
 * 消费循环会在配额窗口、间隔与退避等待上长时间阻塞，不应放进 {@code ForkJoinPool.commonPool()}。
 *
 * <p>该类型为线程安全且不可变对象。
 */
public final class Dispatcher {

    private static final AtomicInteger DEDICATED_IDS = new AtomicInteger(1);

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final String name;

    private Dispatcher(ExecutorService executor, boolean ownsExecutor, String name) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.name = name;
    }

    /**
     * 创建独占的单线程分发器（默认）。
     *
     * <p>线程为守护线程，队列排空 60 秒后自动回收，下次提交时按需重建；
     * 调度器关闭时一并关闭。
     */
    public static Dispatcher dedicated() {
        int id = DEDICATED_IDS.getAndIncrement();
        // a loop that is just exiting may still hold the thread when the next one is submitted
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
            1,
            1,
            60L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            new NamedThreadFactory("throttleforge-consumer-" + id)
        );
        executor.allowCoreThreadTimeOut(true);
        return new Dispatcher(executor, true, "dedicated-" + id);
    }

    /**
     * 基于外部执行器创建分发器。
     *
     * <p>生命周期由调用方管理，调度器不会关闭该执行器。
     *
     * <p>示例：
     * <pre>{@code
     * ExecutorService pool = Executors.newSingleThreadExecutor();
     * AdmissionScheduler scheduler = AdmissionScheduler.open().withDispatcher(Dispatcher.from(pool));
     * }</pre>
     */
    public static Dispatcher from(ExecutorService executor) {
        Objects.requireNonNull(executor, "executor");
        return new Dispatcher(executor, false, "external");
    }

    /**
     * 分发器名称（用于日志）。
     */
    public String name() {
        return name;
    }

    /**
     * 是否拥有底层执行器的所有权。
     */
    public boolean ownsExecutor() {
        return ownsExecutor;
    }

    /**
     * 提交消费循环。
     *
     * @throws java.util.concurrent.RejectedExecutionException 执行器拒绝时
     */
    void execute(Runnable consumerLoop) {
        executor.execute(consumerLoop);
    }

    /**
     * 拥有执行器所有权时，关闭执行器并中断正在运行的消费循环。
     */
    void shutdownIfOwned() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    /**
     * 消费线程命名工厂，便于排查线程来源。
     */
    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger id;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
            this.id = new AtomicInteger(1);
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + id.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
