package io.throttleforge;

import io.throttleforge.internal.DefaultCancellationToken;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 单个准入任务的句柄。
 *
 * <p>{@code Task} 持有调用方的结果槽（一个只会被完成一次的 {@link CompletableFuture}），
 * 以及诊断用的元数据：提交时间、调用方上下文、已执行的尝试次数。
 *
 * <p>结果语义：操作成功、重试耗尽、遇到不可重试错误、或被取消，四者只会发生其一，
 * 结果槽不会被二次赋值。
 *
 * <p>示例：
 * <pre>{@code
 * Task<String> section = scheduler.submit(() -> client.generate(prompt), TaskContext.named("overview"));
 * String text = section.await();
 * }</pre>
 */
public final class Task<T> {

    /**
     * 任务生命周期状态。
     */
    public enum State {
        /** 已入队，尚未准入。 */
        QUEUED,
        /** 已准入，正在执行（含重试等待）。 */
        RUNNING,
        /** 成功完成。 */
        SUCCESS,
        /** 失败完成（不可重试错误或重试耗尽）。 */
        FAILED,
        /** 已取消。 */
        CANCELLED
    }

    /**
     * 取消回调，由调度器注册，用于把排队中的任务移出队列。
     */
    interface CancelListener {
        void onCancelled(Task<?> task);
    }

    private final long id;
    private final String name;
    private final TaskContext context;
    private final Instant createdAt;
    private final Operation<T> operation;
    private final CompletableFuture<T> future;
    private final AtomicReference<State> state;
    private final AtomicInteger attempts;
    private final DefaultCancellationToken token;

    /**
     * 包级构造函数，仅供 {@link AdmissionScheduler} 创建任务。
     */
    Task(
        long id,
        String name,
        TaskContext context,
        Instant createdAt,
        Operation<T> operation,
        CancellationToken schedulerToken,
        final CancelListener cancelListener
    ) {
        this.id = id;
        this.name = name;
        this.context = context;
        this.createdAt = createdAt;
        this.operation = operation;
        this.future = new CompletableFuture<T>();
        this.state = new AtomicReference<State>(State.QUEUED);
        this.attempts = new AtomicInteger(0);
        this.token = new DefaultCancellationToken(schedulerToken, new Runnable() {
            @Override
            public void run() {
                if (completeCancelled(new CancelledException("Task " + Task.this.name + " cancelled"))) {
                    cancelListener.onCancelled(Task.this);
                }
            }
        }, "Task " + name + " cancelled");
    }

    /**
     * 任务 ID（在同一个调度器内单调递增，即入队顺序）。
     */
    public long id() {
        return id;
    }

    /**
     * 任务名称：调用方上下文中的名称，缺省为 {@code task-<id>}。
     */
    public String name() {
        return name;
    }

    public TaskContext context() {
        return context;
    }

    /**
     * 入队时间，仅用于诊断。
     */
    public Instant createdAt() {
        return createdAt;
    }

    /**
     * 已开始的执行次数；排队中为 0，且永不超过重试上限。
     */
    public int attempts() {
        return attempts.get();
    }

    public State state() {
        return state.get();
    }

    public boolean isDone() {
        return future.isDone();
    }

    public boolean isCancelled() {
        return state.get() == State.CANCELLED || future.isCancelled();
    }

    /**
     * 取消任务。
     *
     * <p>排队中的任务立即以 {@link CancelledException} 结束并移出队列，不占用配额；
     * 运行中的任务不会被中断，但其后续的退避等待与重试不再发生。
     *
     * @return 本次调用是否真正结束了任务
     */
    public boolean cancel() {
        if (future.isDone()) {
            return false;
        }
        token.cancel();
        return state.get() == State.CANCELLED;
    }

    /**
     * 等待任务完成并返回结果。
     *
     * <p>异常语义：
     * 被取消抛 {@link CancelledException}；
     * 运行时异常（包括 {@link RetriesExhaustedException}）原样传播；
     * checked exception 包装为 {@link TaskExecutionException}。
     */
    public T await() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted while waiting for task " + name, e);
        } catch (CancellationException e) {
            throw new CancelledException("Task " + name + " cancelled", e);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    /**
     * 在给定时间内等待任务完成。
     *
     * @throws TaskTimeoutException 超时仍未完成；任务本身不受影响，仍在队列或执行中
     */
    public T await(Duration timeout) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted while waiting for task " + name, e);
        } catch (CancellationException e) {
            throw new CancelledException("Task " + name + " cancelled", e);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (TimeoutException e) {
            throw new TaskTimeoutException("Task " + name + " still pending after " + timeout.toMillis() + "ms");
        }
    }

    /**
     * 暴露底层 {@link CompletableFuture}，用于与外部异步 API 组合。
     */
    public CompletableFuture<T> toCompletableFuture() {
        return future;
    }

    public <U> CompletableFuture<U> thenApply(Function<? super T, ? extends U> function) {
        return future.thenApply(function);
    }

    public <U> CompletableFuture<U> thenCompose(Function<? super T, ? extends CompletionStage<U>> function) {
        return future.thenCompose(function);
    }

    TaskInfo info() {
        return new TaskInfo(id, name, context, createdAt);
    }

    Operation<T> operation() {
        return operation;
    }

    CancellationToken token() {
        return token;
    }

    int recordAttempt() {
        return attempts.incrementAndGet();
    }

    /**
     * 标记进入运行状态；任务已被取消时返回 false。
     */
    boolean markRunning() {
        return state.compareAndSet(State.QUEUED, State.RUNNING);
    }

    boolean completeSuccess(T value) {
        if (future.complete(value)) {
            state.set(State.SUCCESS);
            return true;
        }
        return false;
    }

    boolean completeFailure(Throwable failure) {
        if (future.completeExceptionally(failure)) {
            state.set(State.FAILED);
            return true;
        }
        return false;
    }

    boolean completeCancelled(CancelledException cancelled) {
        if (future.completeExceptionally(cancelled)) {
            state.set(State.CANCELLED);
            return true;
        }
        return false;
    }

    /**
     * 统一异常转换。
     */
    private RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new TaskExecutionException("Task " + name + " failed", cause);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", name=" + name + ", state=" + state.get() + ", attempts=" + attempts.get() + "}";
    }
}
