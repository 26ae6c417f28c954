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
 * Interface defining the callback rejecting a promise.
 * <p>
 * Created by davide-maestroni on 03/12/2018.
 */
public interface Rejecter {

  /**
   * Rejects the bound promise with the specified reason.
   *
   * @param reason the rejection reason.
   * @throws java.lang.IllegalStateException if the promise is already settled.
   */
  void reject(@NotNull Throwable reason);
}
