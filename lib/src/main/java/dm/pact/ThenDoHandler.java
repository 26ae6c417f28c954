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

import dm.pact.promise.Observer;
import dm.pact.util.ConstantConditions;

/**
 * Handler consuming the fulfillment value without producing a new one.
 * <p>
 * Created by davide-maestroni on 03/13/2018.
 *
 * @param <V> the value type.
 */
class ThenDoHandler<V> extends PromiseHandler<V, Void> {

  private final Observer<? super V> mObserver;

  ThenDoHandler(@NotNull final Observer<? super V> observer) {
    mObserver = ConstantConditions.notNull("fulfill", observer);
  }

  @Override
  void fulfill(final V value, @NotNull final SharedState<Void> next) throws Exception {
    mObserver.accept(value);
    next.resolve(null);
  }
}
