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

import dm.pact.executor.ExecutorPool;
import dm.pact.promise.Promise;
import dm.pact.promise.Task;
import dm.pact.util.ConstantConditions;

/**
 * Factory of promises.
 * <p>
 * Instances are immutable: every configuration method returns a new factory, leaving the original
 * one unchanged. By default, promises run their tasks and continuations through the loop executor,
 * that is, synchronously in the calling thread, but without growing the call stack at each step
 * of a chain.
 * <pre><code>
 * final Pact pact = new Pact().on(ExecutorPool.threadExecutor());
 * pact.promise(new Task&lt;Integer&gt;() {
 *
 *   public void perform(final Resolver&lt;Integer&gt; resolver, final Rejecter rejecter) {
 *     resolver.resolve(42);
 *   }
 * }).then(new Mapper&lt;Integer, Integer&gt;() {
 *
 *   public Integer apply(final Integer input) {
 *     return input * 2;
 *   }
 * });
 * </code></pre>
 * <p>
 * Created by davide-maestroni on 03/14/2018.
 */
public class Pact {

  private final Executor mExecutor;

  private final String mLoggerName;

  /**
   * Creates a new factory employing the loop executor.
   *
   * @see ExecutorPool#loopExecutor()
   */
  public Pact() {
    this(ExecutorPool.loopExecutor(), null);
  }

  private Pact(@NotNull final Executor executor, @Nullable final String loggerName) {
    mExecutor = ConstantConditions.notNull("executor", executor);
    mLoggerName = loggerName;
  }

  /**
   * Creates a promise running the specified task through the specified executor.
   *
   * @param task     the task instance.
   * @param executor the executor instance.
   * @param <V>      the value type.
   * @return the new promise.
   */
  @NotNull
  public static <V> Promise<V> promise(@NotNull final Task<V> task,
      @NotNull final Executor executor) {
    return new Pact().on(executor).promise(task);
  }

  /**
   * Creates a promise already rejected with the specified reason.
   *
   * @param reason   the rejection reason.
   * @param executor the executor instance.
   * @param <V>      the value type.
   * @return the new promise.
   */
  @NotNull
  public static <V> Promise<V> reject(@NotNull final Throwable reason,
      @NotNull final Executor executor) {
    return new Pact().on(executor).rejected(reason);
  }

  /**
   * Creates a promise already fulfilled with the specified value.
   *
   * @param value    the fulfillment value.
   * @param executor the executor instance.
   * @param <V>      the value type.
   * @return the new promise.
   */
  @NotNull
  public static <V> Promise<V> resolve(final V value, @NotNull final Executor executor) {
    return new Pact().on(executor).resolved(value);
  }

  @NotNull
  public Executor executor() {
    return mExecutor;
  }

  /**
   * Returns a copy of this factory whose promises log under the specified name.
   *
   * @param loggerName the logger name or null to employ the promise class name.
   * @return the new factory.
   */
  @NotNull
  public Pact loggerName(@Nullable final String loggerName) {
    return new Pact(mExecutor, loggerName);
  }

  /**
   * Returns a copy of this factory whose promises employ the specified executor.
   *
   * @param executor the executor instance.
   * @return the new factory.
   */
  @NotNull
  public Pact on(@NotNull final Executor executor) {
    return new Pact(executor, mLoggerName);
  }

  /**
   * Creates a promise running the specified task.
   * <br>
   * The task is immediately submitted to the executor. Any exception it throws before settling
   * the promise is employed as rejection reason.
   *
   * @param task the task instance.
   * @param <V>  the value type.
   * @return the new promise.
   */
  @NotNull
  public <V> Promise<V> promise(@NotNull final Task<V> task) {
    return new DefaultPromise<V>(task, mExecutor, mLoggerName);
  }

  /**
   * Creates a promise already rejected with the specified reason.
   *
   * @param reason the rejection reason.
   * @param <V>    the value type.
   * @return the new promise.
   */
  @NotNull
  public <V> Promise<V> rejected(@NotNull final Throwable reason) {
    return DefaultPromise.rejected(ConstantConditions.notNull("reason", reason), mExecutor,
        mLoggerName);
  }

  /**
   * Creates a promise already fulfilled with the specified value.
   *
   * @param value the fulfillment value.
   * @param <V>   the value type.
   * @return the new promise.
   */
  @NotNull
  public <V> Promise<V> resolved(final V value) {
    return DefaultPromise.resolved(value, mExecutor, mLoggerName);
  }
}
