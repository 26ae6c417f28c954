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

import org.jetbrains.annotations.Nullable;

/**
 * Interface defining a sink of log messages.
 * <p>
 * Created by davide-maestroni on 02/11/2018.
 */
public interface LogPrinter {

  boolean canLogDbg();

  boolean canLogErr();

  boolean canLogWrn();

  void dbg(@Nullable String message, @Nullable Throwable throwable);

  void err(@Nullable String message, @Nullable Throwable throwable);

  void wrn(@Nullable String message, @Nullable Throwable throwable);
}
