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

import java.util.ArrayList;
import java.util.Locale;
import java.util.concurrent.Executor;

import dm.pact.log.Logger;
import dm.pact.promise.Rejecter;
import dm.pact.promise.RejectionException;
import dm.pact.promise.Resolver;
import dm.pact.promise.SettlementState;
import dm.pact.util.ConstantConditions;
import dm.pact.util.FatalErrors;

/**
 * Class holding the outcome of a promise and the continuations waiting for it.
 * <p>
 * The state transitions at most once from pending to either fulfilled or rejected. Registration
 * and settlement are guarded by the same mutex, so that each continuation is scheduled exactly
 * once: either when the state settles, or at registration time if the state is already settled.
 * The mutex is never held while logging or scheduling continuations.
 * <br>
 * The instance only references the continuations waiting for it, which in turn reference the
 * following states, so that nothing upstream is retained.
 * <p>
 * Created by davide-maestroni on 03/13/2018.
 *
 * @param <V> the value type.
 */
class SharedState<V> implements Resolver<V>, Rejecter {

  private final Executor mExecutor;

  private final Logger mLogger;

  private final Object mMutex = new Object();

  private ArrayList<Continuation<V>> mContinuations = new ArrayList<Continuation<V>>();

  private StatePending mInnerState = new StatePending();

  private Throwable mReason;

  private SettlementState mState = SettlementState.Pending;

  private V mValue;

  SharedState(@NotNull final Executor executor, @Nullable final String loggerName) {
    mExecutor = ConstantConditions.notNull("executor", executor);
    mLogger = Logger.newLogger(this, loggerName, Locale.ENGLISH);
  }

  public void reject(@NotNull final Throwable reason) {
    ConstantConditions.notNull("reason", reason);
    final ArrayList<Continuation<V>> continuations;
    try {
      synchronized (mMutex) {
        mInnerState.innerReject(reason);
        continuations = drainContinuations();
      }

    } catch (final IllegalStateException e) {
      mLogger.wrn(reason, "Cannot reject promise: %s", e.getMessage());
      throw e;
    }

    mLogger.dbg("Rejecting promise with reason [%s => %s]: %s", SettlementState.Pending,
        SettlementState.Rejected, reason);
    scheduleRejection(continuations, reason);
  }

  public void resolve(final V value) {
    final ArrayList<Continuation<V>> continuations;
    try {
      synchronized (mMutex) {
        mInnerState.innerResolve(value);
        continuations = drainContinuations();
      }

    } catch (final IllegalStateException e) {
      mLogger.wrn("Cannot resolve promise: %s", e.getMessage());
      throw e;
    }

    mLogger.dbg("Resolving promise with value [%s => %s]: %s", SettlementState.Pending,
        SettlementState.Fulfilled, value);
    scheduleFulfillment(continuations, value);
  }

  @NotNull
  Executor getExecutor() {
    return mExecutor;
  }

  @NotNull
  Logger getLogger() {
    return mLogger;
  }

  @NotNull
  Throwable getReason() {
    synchronized (mMutex) {
      return mInnerState.getReason();
    }
  }

  @NotNull
  SettlementState getState() {
    synchronized (mMutex) {
      return mState;
    }
  }

  V getValue() {
    synchronized (mMutex) {
      return mInnerState.getValue();
    }
  }

  void register(@NotNull final Continuation<V> continuation) {
    ConstantConditions.notNull("continuation", continuation);
    final SettlementState state;
    final Runnable command;
    synchronized (mMutex) {
      state = mState;
      command = mInnerState.register(continuation);
    }

    mLogger.dbg("Registering continuation to %s promise: %s", state, continuation);
    if (command != null) {
      schedule(command, continuation);
    }
  }

  /**
   * Rejects this state, unless already settled.
   * <br>
   * Failures occurring after the settlement are logged and suppressed.
   *
   * @param reason the rejection reason.
   * @return whether the state has been rejected.
   */
  boolean rejectSafe(@NotNull final Throwable reason) {
    ConstantConditions.notNull("reason", reason);
    final ArrayList<Continuation<V>> continuations;
    synchronized (mMutex) {
      if (mState.isSettled()) {
        continuations = null;

      } else {
        mInnerState.innerReject(reason);
        continuations = drainContinuations();
      }
    }

    if (continuations == null) {
      mLogger.wrn(reason, "Suppressed failure");
      return false;
    }

    mLogger.dbg("Rejecting promise with reason [%s => %s]: %s", SettlementState.Pending,
        SettlementState.Rejected, reason);
    scheduleRejection(continuations, reason);
    return true;
  }

  @NotNull
  private ArrayList<Continuation<V>> drainContinuations() {
    final ArrayList<Continuation<V>> continuations = mContinuations;
    mContinuations = new ArrayList<Continuation<V>>(0);
    return continuations;
  }

  private void schedule(@NotNull final Runnable command,
      @NotNull final Continuation<V> continuation) {
    try {
      mExecutor.execute(command);

    } catch (final Throwable t) {
      FatalErrors.throwIfFatal(t);
      mLogger.err(t, "Error while scheduling continuation: %s", continuation);
      continuation.abort(t);
    }
  }

  private void scheduleFulfillment(@NotNull final ArrayList<Continuation<V>> continuations,
      final V value) {
    for (final Continuation<V> continuation : continuations) {
      schedule(new FulfillCommand<V>(continuation, value), continuation);
    }
  }

  private void scheduleRejection(@NotNull final ArrayList<Continuation<V>> continuations,
      @NotNull final Throwable reason) {
    for (final Continuation<V> continuation : continuations) {
      schedule(new RejectCommand<V>(continuation, reason), continuation);
    }
  }

  private static class FulfillCommand<V> implements Runnable {

    private final Continuation<V> mContinuation;

    private final V mValue;

    private FulfillCommand(@NotNull final Continuation<V> continuation, final V value) {
      mContinuation = continuation;
      mValue = value;
    }

    public void run() {
      mContinuation.fulfill(mValue);
    }
  }

  private static class RejectCommand<V> implements Runnable {

    private final Continuation<V> mContinuation;

    private final Throwable mReason;

    private RejectCommand(@NotNull final Continuation<V> continuation,
        @NotNull final Throwable reason) {
      mContinuation = continuation;
      mReason = reason;
    }

    public void run() {
      mContinuation.reject(mReason);
    }
  }

  private class StateFulfilled extends StatePending {

    @Override
    V getValue() {
      return mValue;
    }

    @Override
    void innerReject(@NotNull final Throwable reason) {
      throw exception(SettlementState.Fulfilled);
    }

    @Override
    void innerResolve(final V value) {
      throw exception(SettlementState.Fulfilled);
    }

    @NotNull
    @Override
    Runnable register(@NotNull final Continuation<V> continuation) {
      return new FulfillCommand<V>(continuation, mValue);
    }
  }

  private class StatePending {

    @NotNull
    IllegalStateException exception(@NotNull final SettlementState state) {
      return new IllegalStateException("invalid state: " + state);
    }

    @NotNull
    Throwable getReason() {
      throw exception(mState);
    }

    V getValue() {
      throw exception(SettlementState.Pending);
    }

    void innerReject(@NotNull final Throwable reason) {
      mReason = reason;
      mState = SettlementState.Rejected;
      mInnerState = new StateRejected();
    }

    void innerResolve(final V value) {
      mValue = value;
      mState = SettlementState.Fulfilled;
      mInnerState = new StateFulfilled();
    }

    @Nullable
    Runnable register(@NotNull final Continuation<V> continuation) {
      mContinuations.add(continuation);
      return null;
    }
  }

  private class StateRejected extends StatePending {

    @NotNull
    @Override
    Throwable getReason() {
      return mReason;
    }

    @Override
    V getValue() {
      throw RejectionException.wrap(mReason);
    }

    @Override
    void innerReject(@NotNull final Throwable reason) {
      throw exception(SettlementState.Rejected);
    }

    @Override
    void innerResolve(final V value) {
      throw exception(SettlementState.Rejected);
    }

    @NotNull
    @Override
    Runnable register(@NotNull final Continuation<V> continuation) {
      return new RejectCommand<V>(continuation, mReason);
    }
  }
}
