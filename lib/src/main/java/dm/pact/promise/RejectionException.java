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


package dm.pact.promise;

import org.jetbrains.annotations.NotNull;

import java.io.PrintStream;
import java.io.PrintWriter;

import dm.pact.log.Logger;
import dm.pact.util.ConstantConditions;

/**
 * Exception wrapping the reason of a promise rejection, so that it can be re-raised as an
 * unchecked exception in whatever thread observes the outcome.
 * <br>
 * Messages and stack traces are delegated to the wrapped reason.
 * <p>
 * Created by davide-maestroni on 07/04/2017.
 */
public class RejectionException extends RuntimeException {

  /**
   * Constructor.
   *
   * @param reason the rejection reason.
   */
  public RejectionException(@NotNull final Throwable reason) {
    super(ConstantConditions.notNull("reason", reason));
  }

  /**
   * Wraps the specified reason, unless it is already a rejection exception.
   *
   * @param reason the rejection reason.
   * @return the rejection exception.
   */
  @NotNull
  public static RejectionException wrap(@NotNull final Throwable reason) {
    if (reason instanceof RejectionException) {
      return (RejectionException) reason;
    }

    return new RejectionException(reason);
  }

  @Override
  public String getMessage() {
    return getCause().getMessage();
  }

  @Override
  public String getLocalizedMessage() {
    return getCause().getLocalizedMessage();
  }

  @NotNull
  @Override
  public final Throwable getCause() {
    return super.getCause();
  }

  @Override
  public void printStackTrace(final PrintStream printStream) {
    getCause().printStackTrace(printStream);
  }

  @Override
  public void printStackTrace(final PrintWriter printWriter) {
    getCause().printStackTrace(printWriter);
  }

  @NotNull
  public String printStackTraceToString() {
    return Logger.printStackTrace(getCause());
  }
}
