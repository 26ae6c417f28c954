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

import java.util.concurrent.Executor;

/**
 * Interface defining a promise, that is, a container of a value which will become available
 * asynchronously, or of the reason why it could not be computed.
 * <p>
 * Continuations are chained to a promise by means of the {@code then} methods. Each call returns a
 * new promise, settled with the result of the invoked handler. A handler throwing an exception
 * rejects the returned promise with that exception, while a rejection handler returning normally
 * fulfills it.
 * <br>
 * Handlers are always run through the executor associated with the promise, even if the promise
 * is already settled when they are chained. Handlers chained to the same promise are scheduled in
 * the order they were chained.
 * <p>
 * None of the methods of this interface blocks the calling thread.
 * <p>
 * Created by davide-maestroni on 03/12/2018.
 *
 * @param <V> the value type.
 */
public interface Promise<V> {

  /**
   * Returns the current settlement state.
   *
   * @return the state.
   */
  @NotNull
  SettlementState getState();

  /**
   * Checks if this promise is fulfilled.
   *
   * @return whether the promise is fulfilled.
   */
  boolean isFulfilled();

  /**
   * Checks if this promise is still pending.
   *
   * @return whether the promise is pending.
   */
  boolean isPending();

  /**
   * Checks if this promise is rejected.
   *
   * @return whether the promise is rejected.
   */
  boolean isRejected();

  /**
   * Returns the rejection reason.
   *
   * @return the reason.
   * @throws java.lang.IllegalStateException if the promise is not rejected.
   */
  @NotNull
  Throwable reason();

  /**
   * Returns a promise forwarding the outcome of this one, whose continuations will be run
   * through the specified executor.
   *
   * @param executor the executor instance.
   * @return the new promise.
   */
  @NotNull
  Promise<V> scheduleOn(@NotNull Executor executor);

  /**
   * Chains the specified fulfillment handler to this promise.
   * <br>
   * In case of rejection, the returned promise is rejected with the very same reason.
   *
   * @param fulfill the mapper of the fulfillment value.
   * @param <R>     the returned value type.
   * @return the new promise.
   */
  @NotNull
  <R> Promise<R> then(@NotNull Mapper<? super V, ? extends R> fulfill);

  /**
   * Chains the specified fulfillment and rejection handlers to this promise.
   *
   * @param fulfill the mapper of the fulfillment value.
   * @param reject  the mapper of the rejection reason.
   * @param <R>     the returned value type.
   * @return the new promise.
   */
  @NotNull
  <R> Promise<R> then(@NotNull Mapper<? super V, ? extends R> fulfill,
      @NotNull Mapper<? super Throwable, ? extends R> reject);

  /**
   * Chains the specified rejection handler to this promise.
   * <br>
   * In case of fulfillment, the returned promise is fulfilled with the very same value.
   *
   * @param reject the mapper of the rejection reason.
   * @return the new promise.
   */
  @NotNull
  Promise<V> thenCatch(@NotNull Mapper<? super Throwable, ? extends V> reject);

  /**
   * Chains the specified observer of the fulfillment value to this promise.
   * <br>
   * The returned promise is fulfilled with a {@code null} value as soon as the observer returns.
   *
   * @param fulfill the observer of the fulfillment value.
   * @return the new promise.
   */
  @NotNull
  Promise<Void> thenDo(@NotNull Observer<? super V> fulfill);

  /**
   * Chains the specified action to this promise, so that it is performed in both cases of
   * fulfillment and rejection.
   * <br>
   * The returned promise is settled with the outcome of this one, unless the action throws an
   * exception, in which case it is rejected with it.
   *
   * @param action the action to perform.
   * @return the new promise.
   */
  @NotNull
  Promise<V> thenFinally(@NotNull Action action);

  /**
   * Returns the fulfillment value.
   *
   * @return the value.
   * @throws java.lang.IllegalStateException if the promise is still pending.
   * @throws dm.pact.promise.RejectionException if the promise is rejected.
   */
  V value();
}
