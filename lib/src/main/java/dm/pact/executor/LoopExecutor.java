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

import java.util.ArrayDeque;
import java.util.concurrent.Executor;

import dm.pact.log.Logger;
import dm.pact.util.ConstantConditions;
import dm.pact.util.FatalErrors;

/**
 * Class implementing a synchronous loop executor.
 * <p>
 * The executor maintains a per-thread buffer of commands that are consumed only when the last one
 * completes, thus avoiding overflowing the call stack because of nested calls to other routines.
 * A command submitted while no other command is running in the same thread is executed before
 * the call to {@code execute()} returns.
 * <p>
 * Created by davide-maestroni on 09/18/2014.
 */
class LoopExecutor implements Executor {

  private static final LoopExecutor sInstance = new LoopExecutor();

  private final ThreadLocal<LocalQueue> mQueues = new ThreadLocal<LocalQueue>() {

    @Override
    protected LocalQueue initialValue() {
      return new LocalQueue();
    }
  };

  private final Logger mLogger;

  /**
   * Avoid explicit instantiation.
   */
  private LoopExecutor() {
    mLogger = Logger.newLogger(this);
  }

  @NotNull
  static LoopExecutor instance() {
    return sInstance;
  }

  public void execute(@NotNull final Runnable command) {
    mQueues.get().run(ConstantConditions.notNull("command", command));
  }

  private class LocalQueue {

    private final ArrayDeque<Runnable> mCommands = new ArrayDeque<Runnable>();

    private boolean mIsRunning;

    void run(@NotNull final Runnable command) {
      final ArrayDeque<Runnable> commands = mCommands;
      commands.add(command);
      if (mIsRunning) {
        return;
      }

      mIsRunning = true;
      try {
        Runnable next;
        while ((next = commands.poll()) != null) {
          try {
            next.run();

          } catch (final Throwable t) {
            FatalErrors.throwIfFatal(t);
            mLogger.wrn(t, "Suppressed exception");
          }
        }

      } finally {
        mIsRunning = false;
      }
    }
  }
}
