/*
 * Copyright 2018 Davide Maestroni
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dm.pact;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.Executor;

import dm.pact.promise.Action;
import dm.pact.promise.Mapper;
import dm.pact.promise.Observer;
import dm.pact.promise.Promise;
import dm.pact.promise.SettlementState;
import dm.pact.promise.Task;
import dm.pact.util.ConstantConditions;
import dm.pact.util.FatalErrors;

/**
 * Default implementation of a promise.
 * <br>
 * The instance is just a handle to the shared state, so the promises of a chain do not keep any
 * reference to the previous ones.
 * <p>
 * Created by davide-maestroni on 03/13/2018.
 *
 * @param <V> the value type.
 */
class DefaultPromise<V> implements Promise<V> {

  private final SharedState<V> mState;

  DefaultPromise(@NotNull final Task<V> task, @NotNull final Executor executor,
      @Nullable final String loggerName) {
    this(executor, loggerName);
    final TaskCommand<V> command = new TaskCommand<V>(task, mState);
    try {
      executor.execute(command);

    } catch (final Throwable t) {
      FatalErrors.throwIfFatal(t);
      mState.getLogger().err(t, "Error while scheduling task: %s", task);
      mState.rejectSafe(t);
    }
  }

  private DefaultPromise(@NotNull final Executor executor, @Nullable final String loggerName) {
    this(new SharedState<V>(executor, loggerName));
  }

  private DefaultPromise(@NotNull final SharedState<V> state) {
    mState = state;
  }

  @NotNull
  static <V> DefaultPromise<V> rejected(@NotNull final Throwable reason,
      @NotNull final Executor executor, @Nullable final String loggerName) {
    final DefaultPromise<V> promise = new DefaultPromise<V>(executor, loggerName);
    promise.mState.reject(reason);
    return promise;
  }

  @NotNull
  static <V> DefaultPromise<V> resolved(final V value, @NotNull final Executor executor,
      @Nullable final String loggerName) {
    final DefaultPromise<V> promise = new DefaultPromise<V>(executor, loggerName);
    promise.mState.resolve(value);
    return promise;
  }

  @NotNull
  public SettlementState getState() {
    return mState.getState();
  }

  public boolean isFulfilled() {
    return (getState() == SettlementState.Fulfilled);
  }

  public boolean isPending() {
    return (getState() == SettlementState.Pending);
  }

  public boolean isRejected() {
    return (getState() == SettlementState.Rejected);
  }

  @NotNull
  public Throwable reason() {
    return mState.getReason();
  }

  @NotNull
  public Promise<V> scheduleOn(@NotNull final Executor executor) {
    return chain(new PromiseHandler<V, V>(), ConstantConditions.notNull("executor", executor));
  }

  @NotNull
  public <R> Promise<R> then(@NotNull final Mapper<? super V, ? extends R> fulfill) {
    return chain(new ThenHandler<V, R>(fulfill, null), mState.getExecutor());
  }

  @NotNull
  public <R> Promise<R> then(@NotNull final Mapper<? super V, ? extends R> fulfill,
      @NotNull final Mapper<? super Throwable, ? extends R> reject) {
    return chain(new ThenHandler<V, R>(fulfill, ConstantConditions.notNull("reject", reject)),
        mState.getExecutor());
  }

  @NotNull
  public Promise<V> thenCatch(@NotNull final Mapper<? super Throwable, ? extends V> reject) {
    return chain(new CatchHandler<V>(reject), mState.getExecutor());
  }

  @NotNull
  public Promise<Void> thenDo(@NotNull final Observer<? super V> fulfill) {
    return chain(new ThenDoHandler<V>(fulfill), mState.getExecutor());
  }

  @NotNull
  public Promise<V> thenFinally(@NotNull final Action action) {
    return chain(new FinallyHandler<V>(action), mState.getExecutor());
  }

  public V value() {
    return mState.getValue();
  }

  @NotNull
  private <R> Promise<R> chain(@NotNull final PromiseHandler<V, R> handler,
      @NotNull final Executor executor) {
    final SharedState<R> next = new SharedState<R>(executor, mState.getLogger().getName());
    final DefaultPromise<R> promise = new DefaultPromise<R>(next);
    mState.register(new HandlerContinuation<V, R>(handler, next));
    return promise;
  }

  private static class HandlerContinuation<V, R> implements Continuation<V> {

    private final PromiseHandler<V, R> mHandler;

    private final SharedState<R> mNext;

    private HandlerContinuation(@NotNull final PromiseHandler<V, R> handler,
        @NotNull final SharedState<R> next) {
      mHandler = handler;
      mNext = next;
    }

    public void abort(@NotNull final Throwable failure) {
      mNext.rejectSafe(failure);
    }

    public void fulfill(final V value) {
      final SharedState<R> next = mNext;
      try {
        next.getLogger().dbg("Processing value: %s", value);
        mHandler.fulfill(value, next);

      } catch (final Throwable t) {
        FatalErrors.throwIfFatal(t);
        next.getLogger().err(t, "Error while processing value: %s", value);
        next.rejectSafe(t);
      }
    }

    public void reject(@NotNull final Throwable reason) {
      final SharedState<R> next = mNext;
      try {
        next.getLogger().dbg("Processing rejection with reason: %s", reason);
        mHandler.reject(reason, next);

      } catch (final Throwable t) {
        FatalErrors.throwIfFatal(t);
        next.getLogger().err(t, "Error while processing rejection with reason: %s", reason);
        next.rejectSafe(t);
      }
    }
  }

  /**
   * Command performing the promise task.
   * <br>
   * A task settling the promise twice gets an {@code IllegalStateException} from the second call.
   * If the task lets it escape, the exception is logged as a suppressed failure, since the promise
   * outcome cannot change anymore.
   */
  private static class TaskCommand<V> implements Runnable {

    private final SharedState<V> mState;

    private final Task<V> mTask;

    private TaskCommand(@NotNull final Task<V> task, @NotNull final SharedState<V> state) {
      mTask = ConstantConditions.notNull("task", task);
      mState = state;
    }

    public void run() {
      final SharedState<V> state = mState;
      try {
        state.getLogger().dbg("Performing task: %s", mTask);
        mTask.perform(state, state);

      } catch (final Throwable t) {
        FatalErrors.throwIfFatal(t);
        state.getLogger().err(t, "Error while performing task: %s", mTask);
        state.rejectSafe(t);
      }
    }
  }
}
