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

import java.util.List;

/**
 * Interface defining an object providing the printers employed by the loggers.
 * <p>
 * Created by davide-maestroni on 02/11/2018.
 */
public interface LogConnector {

  /**
   * Returns the printer to be used by the logger with the specified name and contexts.
   *
   * @param loggerName the logger name.
   * @param contexts   the unmodifiable list of logger contexts.
   * @return the printer instance.
   */
  @NotNull
  LogPrinter getPrinter(@NotNull String loggerName, @NotNull List<Object> contexts);
}
