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
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;

import dm.pact.log.Logger;
import dm.pact.util.ConstantConditions;
import dm.pact.util.FatalErrors;

/**
 * Executor implementation running each command in a new thread, which is never joined.
 * <br>
 * Exceptions thrown by the command are logged and suppressed.
 * <p>
 * Created by davide-maestroni on 03/15/2018.
 */
class ThreadExecutor implements Executor {

  private final Logger mLogger;

  private final ThreadFactory mThreadFactory;

  ThreadExecutor(@NotNull final ThreadFactory threadFactory) {
    mThreadFactory = ConstantConditions.notNull("threadFactory", threadFactory);
    mLogger = Logger.newLogger(this);
  }

  public void execute(@NotNull final Runnable command) {
    final Thread thread = mThreadFactory.newThread(new SafeCommand(command));
    if (thread == null) {
      throw new RejectedExecutionException("the thread factory returned a null thread");
    }

    thread.start();
  }

  private class SafeCommand implements Runnable {

    private final Runnable mCommand;

    private SafeCommand(@NotNull final Runnable command) {
      mCommand = ConstantConditions.notNull("command", command);
    }

    public void run() {
      try {
        mCommand.run();

      } catch (final Throwable t) {
        FatalErrors.throwIfFatal(t);
        mLogger.wrn(t, "Suppressed exception");
      }
    }
  }
}
