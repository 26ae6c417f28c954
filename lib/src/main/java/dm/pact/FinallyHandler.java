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

import dm.pact.promise.Action;
import dm.pact.util.ConstantConditions;

/**
 * Handler performing an action before forwarding the outcome unchanged.
 * <p>
 * Created by davide-maestroni on 03/13/2018.
 *
 * @param <V> the value type.
 */
class FinallyHandler<V> extends PromiseHandler<V, V> {

  private final Action mAction;

  FinallyHandler(@NotNull final Action action) {
    mAction = ConstantConditions.notNull("action", action);
  }

  @Override
  void fulfill(final V value, @NotNull final SharedState<V> next) throws Exception {
    mAction.perform();
    super.fulfill(value, next);
  }

  @Override
  void reject(@NotNull final Throwable reason, @NotNull final SharedState<V> next) throws
      Exception {
    mAction.perform();
    super.reject(reason, next);
  }
}
