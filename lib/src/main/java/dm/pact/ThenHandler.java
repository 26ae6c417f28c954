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
import org.jetbrains.annotations.Nullable;

import dm.pact.promise.Mapper;
import dm.pact.util.ConstantConditions;

/**
 * Handler mapping the outcome of a promise into the value of the next one.
 * <br>
 * When no rejection mapper is specified, the rejection reason is forwarded unchanged.
 * <p>
 * Created by davide-maestroni on 03/13/2018.
 *
 * @param <V> the input value type.
 * @param <R> the output value type.
 */
class ThenHandler<V, R> extends PromiseHandler<V, R> {

  private final Mapper<? super V, ? extends R> mFulfill;

  private final Mapper<? super Throwable, ? extends R> mReject;

  ThenHandler(@NotNull final Mapper<? super V, ? extends R> fulfill,
      @Nullable final Mapper<? super Throwable, ? extends R> reject) {
    mFulfill = ConstantConditions.notNull("fulfill", fulfill);
    mReject = reject;
  }

  @Override
  void fulfill(final V value, @NotNull final SharedState<R> next) throws Exception {
    next.resolve(mFulfill.apply(value));
  }

  @Override
  void reject(@NotNull final Throwable reason, @NotNull final SharedState<R> next) throws
      Exception {
    final Mapper<? super Throwable, ? extends R> reject = mReject;
    if (reject == null) {
      super.reject(reason, next);

    } else {
      next.resolve(reject.apply(reason));
    }
  }
}
