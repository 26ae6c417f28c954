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

import dm.pact.promise.Mapper;
import dm.pact.util.ConstantConditions;

/**
 * Handler recovering from a rejection by mapping the reason into a value.
 * <p>
 * Created by davide-maestroni on 03/13/2018.
 *
 * @param <V> the value type.
 */
class CatchHandler<V> extends PromiseHandler<V, V> {

  private final Mapper<? super Throwable, ? extends V> mMapper;

  CatchHandler(@NotNull final Mapper<? super Throwable, ? extends V> mapper) {
    mMapper = ConstantConditions.notNull("reject", mapper);
  }

  @Override
  void reject(@NotNull final Throwable reason, @NotNull final SharedState<V> next) throws
      Exception {
    next.resolve(mMapper.apply(reason));
  }
}
