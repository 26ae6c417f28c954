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

/**
 * Interface defining the task computing the outcome of a promise.
 * <br>
 * The task must call exactly once either the resolver or the rejecter, in the same or in a
 * different thread. Any exception thrown by the task before that is employed as rejection reason.
 * <p>
 * Created by davide-maestroni on 03/12/2018.
 *
 * @param <V> the value type.
 */
public interface Task<V> {

  /**
   * Performs the task.
   *
   * @param resolver the callback fulfilling the promise.
   * @param rejecter the callback rejecting the promise.
   * @throws java.lang.Exception if an error occurred.
   */
  void perform(@NotNull Resolver<V> resolver, @NotNull Rejecter rejecter) throws Exception;
}
