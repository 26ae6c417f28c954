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
 * Interface defining a unit of work waiting for the settlement of a promise state.
 * <p>
 * Created by davide-maestroni on 03/13/2018.
 *
 * @param <V> the value type.
 */
interface Continuation<V> {

  /**
   * Notifies the continuation that it could not be scheduled.
   * <br>
   * None of the continuation handlers must be invoked.
   *
   * @param failure the scheduling failure.
   */
  void abort(@NotNull Throwable failure);

  void fulfill(V value);

  void reject(@NotNull Throwable reason);
}
