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

/**
 * Base class for handlers of the outcome of a promise, in charge of settling the next one.
 * <br>
 * The default implementation just forwards the outcome unchanged.
 * <p>
 * Created by davide-maestroni on 03/13/2018.
 *
 * @param <V> the input value type.
 * @param <R> the output value type.
 */
class PromiseHandler<V, R> {

  @SuppressWarnings("unchecked")
  void fulfill(final V value, @NotNull final SharedState<R> next) throws Exception {
    next.resolve((R) value);
  }

  void reject(@NotNull final Throwable reason, @NotNull final SharedState<R> next) throws
      Exception {
    next.reject(reason);
  }
}
