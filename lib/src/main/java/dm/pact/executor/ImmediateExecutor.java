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

import dm.pact.log.Logger;
import dm.pact.util.ConstantConditions;
import dm.pact.util.FatalErrors;

/**
 * Executor running each command synchronously, before the call to {@code execute()} returns.
 * <br>
 * Nested commands are run right away as well, so every settled promise of a synchronous chain adds
 * a few frames to the call stack. Failures escaping a command are logged and suppressed, while
 * errors of the virtual machine (like a {@code StackOverflowError}) are propagated to the caller.
 * <p>
 * Created by davide-maestroni on 03/15/2018.
 */
class ImmediateExecutor implements Executor {

  private static final ImmediateExecutor sInstance = new ImmediateExecutor();

  private final Logger mLogger = Logger.newLogger(this);

  private ImmediateExecutor() {
  }

  @NotNull
  static ImmediateExecutor instance() {
    return sInstance;
  }

  public void execute(@NotNull final Runnable command) {
    ConstantConditions.notNull("command", command);
    try {
      command.run();

    } catch (final Throwable t) {
      FatalErrors.throwIfFatal(t);
      mLogger.wrn(t, "Suppressed failure of command: %s", command);
    }
  }
}
