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


package dm.pact.log;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Connector printing messages through the {@code java.util.logging} framework.
 * <br>
 * Debug messages are mapped to {@link Level#FINE}, warnings to {@link Level#WARNING} and errors to
 * {@link Level#SEVERE}. The class of the outermost logger context is reported as the source of
 * each record.
 * <p>
 * Created by davide-maestroni on 02/11/2018.
 */
class JavaLoggingConnector implements LogConnector {

  @NotNull
  public LogPrinter getPrinter(@NotNull final String loggerName,
      @NotNull final List<Object> contexts) {
    final String sourceName = contexts.isEmpty() ? null : contexts.get(0).getClass().getName();
    return new JavaLogPrinter(Logger.getLogger(loggerName), sourceName);
  }

  private static class JavaLogPrinter implements LogPrinter {

    private final Logger mLogger;

    private final String mSourceName;

    private JavaLogPrinter(@NotNull final Logger logger, @Nullable final String sourceName) {
      mLogger = logger;
      mSourceName = sourceName;
    }

    public boolean canLogDbg() {
      return mLogger.isLoggable(Level.FINE);
    }

    public boolean canLogErr() {
      return mLogger.isLoggable(Level.SEVERE);
    }

    public boolean canLogWrn() {
      return mLogger.isLoggable(Level.WARNING);
    }

    public void dbg(@Nullable final String message, @Nullable final Throwable throwable) {
      log(Level.FINE, message, throwable);
    }

    public void err(@Nullable final String message, @Nullable final Throwable throwable) {
      log(Level.SEVERE, message, throwable);
    }

    public void wrn(@Nullable final String message, @Nullable final Throwable throwable) {
      log(Level.WARNING, message, throwable);
    }

    private void log(@NotNull final Level level, @Nullable final String message,
        @Nullable final Throwable throwable) {
      final Logger logger = mLogger;
      final LogRecord record = new LogRecord(level, message);
      record.setLoggerName(logger.getName());
      record.setSourceClassName(mSourceName);
      record.setThrown(throwable);
      logger.log(record);
    }
  }
}
