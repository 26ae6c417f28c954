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


package dm.pact.executor;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import dm.pact.util.ConstantConditions;

/**
 * Utility class for creating and sharing executor instances.
 * <p>
 * None of the returned executors propagates the exceptions thrown by the executed commands.
 * <p>
 * Created by davide-maestroni on 09/09/2014.
 */
@SuppressWarnings("WeakerAccess")
public class ExecutorPool {

  private static final Object sMutex = new Object();

  private static Executor sThreadExecutor;

  /**
   * Avoid explicit instantiation.
   */
  protected ExecutorPool() {
    ConstantConditions.avoid();
  }

  /**
   * Returns the shared instance of an immediate executor.
   * <p>
   * The returned executor will immediately run any passed command in the calling thread.
   * <p>
   * Be careful when employing the returned executor with long chains of promises, since each
   * continuation is run inside the call settling the previous promise, thus possibly overflowing
   * the call stack. In such case the {@code StackOverflowError} is propagated to the caller
   * settling the first promise of the chain.
   *
   * @return the executor instance.
   */
  @NotNull
  public static Executor immediateExecutor() {
    return ImmediateExecutor.instance();
  }

  /**
   * Returns the shared instance of a synchronous loop executor.
   * <p>
   * The returned executor maintains an internal buffer of commands that are consumed only when
   * the last one completes, thus avoiding overflowing the call stack because of nested calls.
   *
   * @return the executor instance.
   */
  @NotNull
  public static Executor loopExecutor() {
    return LoopExecutor.instance();
  }

  /**
   * Returns the shared instance of an executor running each command in a newly started daemon
   * thread.
   *
   * @return the executor instance.
   */
  @NotNull
  public static Executor threadExecutor() {
    synchronized (sMutex) {
      if (sThreadExecutor == null) {
        sThreadExecutor = new ThreadExecutor(new DaemonThreadFactory("pact-thread-"));
      }

      return sThreadExecutor;
    }
  }

  /**
   * Returns an executor running each command in a new thread created by the specified factory.
   *
   * @param threadFactory the thread factory.
   * @return the executor instance.
   */
  @NotNull
  public static Executor threadExecutor(@NotNull final ThreadFactory threadFactory) {
    return new ThreadExecutor(threadFactory);
  }

  private static class DaemonThreadFactory implements ThreadFactory {

    private final AtomicInteger mCount = new AtomicInteger();

    private final String mNamePrefix;

    private DaemonThreadFactory(@NotNull final String namePrefix) {
      mNamePrefix = namePrefix;
    }

    public Thread newThread(@NotNull final Runnable runnable) {
      final Thread thread = new Thread(runnable, mNamePrefix + mCount.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
