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
import org.junit.Test;

import java.io.IOException;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import dm.pact.log.LogConnector;
import dm.pact.log.LogPrinter;
import dm.pact.log.Logger;
import dm.pact.promise.Action;
import dm.pact.promise.Mapper;
import dm.pact.promise.Observer;
import dm.pact.promise.Promise;
import dm.pact.promise.Rejecter;
import dm.pact.promise.RejectionException;
import dm.pact.promise.Resolver;
import dm.pact.promise.SettlementState;
import dm.pact.promise.Task;
import dm.pact.util.FatalErrors;

import static dm.pact.executor.ExecutorPool.immediateExecutor;
import static dm.pact.executor.ExecutorPool.loopExecutor;
import static dm.pact.executor.ExecutorPool.threadExecutor;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Created by davide-maestroni on 03/16/2018.
 */
public class PromiseTest {

  @NotNull
  private static Mapper<Integer, Integer> doubled() {
    return new Mapper<Integer, Integer>() {

      public Integer apply(final Integer input) {
        return input * 2;
      }
    };
  }

  @NotNull
  private static Mapper<Integer, Integer> failing(@NotNull final RuntimeException exception) {
    return new Mapper<Integer, Integer>() {

      public Integer apply(final Integer input) {
        throw exception;
      }
    };
  }

  @NotNull
  private static <V> Task<V> pending(@NotNull final AtomicReference<Resolver<V>> resolver,
      @NotNull final AtomicReference<Rejecter> rejecter) {
    return new Task<V>() {

      public void perform(@NotNull final Resolver<V> res, @NotNull final Rejecter rej) {
        resolver.set(res);
        rejecter.set(rej);
      }
    };
  }

  @NotNull
  private static Executor rejectingExecutor() {
    return new Executor() {

      public void execute(@NotNull final Runnable command) {
        throw new RejectedExecutionException("test");
      }
    };
  }

  @Test
  public void chainAsync() throws InterruptedException {
    final AtomicInteger result = new AtomicInteger();
    final AtomicReference<Thread> thread = new AtomicReference<Thread>();
    final CountDownLatch latch = new CountDownLatch(1);
    Pact.resolve(42, threadExecutor()).then(doubled()).thenDo(new Observer<Integer>() {

      public void accept(final Integer input) {
        result.set(input);
        thread.set(Thread.currentThread());
        latch.countDown();
      }
    });
    assertThat(latch.await(10, SECONDS)).isTrue();
    assertThat(result.get()).isEqualTo(84);
    assertThat(thread.get()).isNotSameAs(Thread.currentThread());
  }

  @Test
  public void chainAttachedAfterSettlement() {
    final Promise<Integer> promise = new Pact().resolved(21);
    assertThat(promise.isFulfilled()).isTrue();
    assertThat(promise.then(doubled()).value()).isEqualTo(42);
  }

  @Test
  public void chainAttachedBeforeSettlement() {
    final AtomicReference<Resolver<Integer>> resolver = new AtomicReference<Resolver<Integer>>();
    final Promise<Integer> promise =
        new Pact().promise(pending(resolver, new AtomicReference<Rejecter>()));
    final Promise<Integer> chained = promise.then(doubled());
    assertThat(chained.isPending()).isTrue();
    resolver.get().resolve(21);
    assertThat(chained.value()).isEqualTo(42);
  }

  @Test
  public void chainDoesNotRetainPreviousPromises() throws InterruptedException {
    Promise<byte[]> first = new Pact().resolved(new byte[1024 * 1024]);
    final WeakReference<Promise<byte[]>> reference = new WeakReference<Promise<byte[]>>(first);
    final Promise<Integer> last = first.then(new Mapper<byte[], Integer>() {

      public Integer apply(final byte[] input) {
        return input.length;
      }
    });
    first = null;
    for (int i = 0; (i < 20) && (reference.get() != null); ++i) {
      System.gc();
      Thread.sleep(50);
    }

    assertThat(reference.get()).isNull();
    assertThat(last.value()).isEqualTo(1024 * 1024);
  }

  @Test
  public void chainSync() {
    final AtomicInteger result = new AtomicInteger();
    final Promise<Void> promise =
        Pact.resolve(42, immediateExecutor()).then(doubled()).thenDo(new Observer<Integer>() {

          public void accept(final Integer input) {
            result.set(input);
          }
        });
    assertThat(result.get()).isEqualTo(84);
    assertThat(promise.isFulfilled()).isTrue();
    assertThat(promise.value()).isNull();
  }

  @Test
  public void concurrentRegistration() throws InterruptedException {
    for (int i = 0; i < 50; ++i) {
      final AtomicReference<Resolver<Integer>> resolver = new AtomicReference<Resolver<Integer>>();
      final Promise<Integer> promise =
          new Pact().promise(pending(resolver, new AtomicReference<Rejecter>()));
      final AtomicInteger count = new AtomicInteger();
      final CountDownLatch start = new CountDownLatch(1);
      final ArrayList<Thread> threads = new ArrayList<Thread>();
      for (int j = 0; j < 4; ++j) {
        threads.add(new Thread() {

          @Override
          public void run() {
            try {
              start.await();

            } catch (final InterruptedException e) {
              return;
            }

            for (int k = 0; k < 100; ++k) {
              promise.thenDo(new Observer<Integer>() {

                public void accept(final Integer input) {
                  count.incrementAndGet();
                }
              });
            }
          }
        });
      }

      threads.add(new Thread() {

        @Override
        public void run() {
          try {
            start.await();

          } catch (final InterruptedException e) {
            return;
          }

          resolver.get().resolve(1);
        }
      });

      for (final Thread thread : threads) {
        thread.start();
      }

      start.countDown();
      for (final Thread thread : threads) {
        thread.join();
      }

      assertThat(count.get()).isEqualTo(400);
    }
  }

  @Test
  public void continuationOrder() {
    final AtomicReference<Resolver<String>> resolver = new AtomicReference<Resolver<String>>();
    final Promise<String> promise =
        new Pact().promise(pending(resolver, new AtomicReference<Rejecter>()));
    final List<Integer> calls = Collections.synchronizedList(new ArrayList<Integer>());
    for (int i = 0; i < 5; ++i) {
      final int index = i;
      promise.thenDo(new Observer<String>() {

        public void accept(final String input) {
          calls.add(index);
        }
      });
    }

    assertThat(calls).isEmpty();
    resolver.get().resolve("test");
    assertThat(calls).containsExactly(0, 1, 2, 3, 4);
  }

  @Test
  public void continuationOnSettledCalledOnce() {
    final AtomicInteger count = new AtomicInteger();
    final Promise<String> promise = new Pact().resolved("test");
    promise.thenDo(new Observer<String>() {

      public void accept(final String input) {
        count.incrementAndGet();
      }
    });
    promise.thenDo(new Observer<String>() {

      public void accept(final String input) {
        count.incrementAndGet();
      }
    });
    assertThat(count.get()).isEqualTo(2);
  }

  @Test
  public void defaultRejectionForwardsReason() {
    final IOException reason = new IOException();
    final AtomicBoolean isCalled = new AtomicBoolean();
    final Promise<Integer> promise =
        new Pact().<Integer>rejected(reason).then(new Mapper<Integer, Integer>() {

          public Integer apply(final Integer input) {
            isCalled.set(true);
            return input;
          }
        }).then(doubled());
    assertThat(promise.isRejected()).isTrue();
    assertThat(promise.reason()).isSameAs(reason);
    assertThat(isCalled.get()).isFalse();
  }

  @Test
  public void defaultExecutorLongChain() {
    final AtomicReference<Resolver<Integer>> resolver = new AtomicReference<Resolver<Integer>>();
    final Promise<Integer> first =
        new Pact().promise(pending(resolver, new AtomicReference<Rejecter>()));
    Promise<Integer> promise = first;
    for (int i = 0; i < 20000; ++i) {
      promise = promise.then(new Mapper<Integer, Integer>() {

        public Integer apply(final Integer input) {
          return input + 1;
        }
      });
    }

    resolver.get().resolve(0);
    assertThat(promise.value()).isEqualTo(20000);
  }

  @Test(expected = IllegalStateException.class)
  public void doubleRejectException() {
    final AtomicReference<Rejecter> rejecter = new AtomicReference<Rejecter>();
    new Pact().promise(pending(new AtomicReference<Resolver<String>>(), rejecter));
    rejecter.get().reject(new IOException());
    rejecter.get().reject(new IOException());
  }

  @Test
  public void doubleSettlementKeepsOutcome() {
    final AtomicReference<Resolver<String>> resolver = new AtomicReference<Resolver<String>>();
    final AtomicReference<Rejecter> rejecter = new AtomicReference<Rejecter>();
    final Promise<String> promise = new Pact().promise(pending(resolver, rejecter));
    resolver.get().resolve("first");
    try {
      resolver.get().resolve("second");

    } catch (final IllegalStateException ignored) {
    }

    try {
      rejecter.get().reject(new IOException());

    } catch (final IllegalStateException ignored) {
    }

    assertThat(promise.isFulfilled()).isTrue();
    assertThat(promise.value()).isEqualTo("first");
  }

  @Test(expected = IllegalStateException.class)
  public void doubleResolveException() {
    final AtomicReference<Resolver<String>> resolver = new AtomicReference<Resolver<String>>();
    new Pact().promise(pending(resolver, new AtomicReference<Rejecter>()));
    resolver.get().resolve("first");
    resolver.get().resolve("second");
  }

  @Test
  public void executorFailureRejectsContinuation() {
    final AtomicBoolean isCalled = new AtomicBoolean();
    final Promise<Integer> promise =
        new Pact().resolved(1).scheduleOn(rejectingExecutor()).then(new Mapper<Integer, Integer>() {

          public Integer apply(final Integer input) {
            isCalled.set(true);
            return input;
          }
        });
    assertThat(promise.isRejected()).isTrue();
    assertThat(promise.reason()).isExactlyInstanceOf(RejectedExecutionException.class);
    assertThat(isCalled.get()).isFalse();
  }

  @Test
  public void executorFailureRejectsPromise() {
    final AtomicBoolean isCalled = new AtomicBoolean();
    final Promise<String> promise = Pact.promise(new Task<String>() {

      public void perform(@NotNull final Resolver<String> resolver,
          @NotNull final Rejecter rejecter) {
        isCalled.set(true);
        resolver.resolve("test");
      }
    }, rejectingExecutor());
    assertThat(promise.isRejected()).isTrue();
    assertThat(promise.reason()).isExactlyInstanceOf(RejectedExecutionException.class);
    assertThat(isCalled.get()).isFalse();
  }

  @Test
  public void failureAfterSettlementIsLogged() {
    final TestLogPrinter printer = new TestLogPrinter(TestLogPrinter.Level.WRN);
    Logger.addConnector(printer);
    try {
      final IllegalArgumentException failure = new IllegalArgumentException("late");
      final Promise<String> promise = new Pact().promise(new Task<String>() {

        public void perform(@NotNull final Resolver<String> resolver,
            @NotNull final Rejecter rejecter) {
          resolver.resolve("test");
          throw failure;
        }
      });
      assertThat(promise.value()).isEqualTo("test");
      assertThat(printer.hasMessage(TestLogPrinter.Level.WRN, "Suppressed failure")).isTrue();
      assertThat(printer.getThrowables()).contains(failure);

    } finally {
      Logger.clearConnectors();
    }
  }

  @Test
  public void finallyActionFailure() {
    final IllegalStateException failure = new IllegalStateException();
    final Promise<String> promise = new Pact().resolved("test").thenFinally(new Action() {

      public void perform() {
        throw failure;
      }
    });
    assertThat(promise.reason()).isSameAs(failure);
  }

  @Test
  public void finallyFulfilled() {
    final AtomicInteger count = new AtomicInteger();
    final Promise<Integer> promise = new Pact().resolved(42).thenFinally(new Action() {

      public void perform() {
        count.incrementAndGet();
      }
    });
    assertThat(count.get()).isEqualTo(1);
    assertThat(promise.value()).isEqualTo(42);
  }

  @Test
  public void finallyRejected() {
    final AtomicInteger count = new AtomicInteger();
    final IOException reason = new IOException();
    final Promise<Integer> promise = new Pact().<Integer>rejected(reason).thenFinally(new Action() {

      public void perform() {
        count.incrementAndGet();
      }
    });
    assertThat(count.get()).isEqualTo(1);
    assertThat(promise.reason()).isSameAs(reason);
  }

  @Test
  public void handlerFailureRejectsNext() {
    final NullPointerException failure = new NullPointerException("test");
    final Promise<Integer> promise = new Pact().resolved(1);
    final Promise<Integer> failed = promise.then(failing(failure));
    final Promise<Integer> sibling = promise.then(doubled());
    assertThat(failed.reason()).isSameAs(failure);
    assertThat(sibling.value()).isEqualTo(2);
    assertThat(promise.value()).isEqualTo(1);
  }

  @Test
  public void immediateExecutorOverflowPropagated() throws InterruptedException {
    assertThat(FatalErrors.isFatal(new StackOverflowError())).isTrue();
    final AtomicReference<Resolver<Integer>> resolver = new AtomicReference<Resolver<Integer>>();
    Promise<Integer> promise = new Pact().on(immediateExecutor())
                                         .promise(pending(resolver,
                                             new AtomicReference<Rejecter>()));
    for (int i = 0; i < 50000; ++i) {
      promise = promise.then(new Mapper<Integer, Integer>() {

        public Integer apply(final Integer input) {
          return input + 1;
        }
      });
    }

    final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
    final Thread thread = new Thread(null, new Runnable() {

      public void run() {
        try {
          resolver.get().resolve(0);

        } catch (final Throwable t) {
          failure.set(t);
        }
      }
    }, "overflow", 256 * 1024);
    thread.start();
    thread.join();
    assertThat(failure.get()).isInstanceOf(StackOverflowError.class);
  }

  @Test
  public void loggingOutsideLock() {
    final AtomicReference<Promise<String>> promise = new AtomicReference<Promise<String>>();
    final AtomicInteger checked = new AtomicInteger();
    final AtomicInteger blocked = new AtomicInteger();
    Logger.addConnector(new LogConnector() {

      @NotNull
      public LogPrinter getPrinter(@NotNull final String loggerName,
          @NotNull final List<Object> contexts) {
        return new LockCheckPrinter(promise, checked, blocked);
      }
    });
    try {
      final AtomicReference<Resolver<String>> resolver = new AtomicReference<Resolver<String>>();
      promise.set(new Pact().promise(pending(resolver, new AtomicReference<Rejecter>())));
      promise.get().thenDo(new Observer<String>() {

        public void accept(final String input) {
        }
      });
      resolver.get().resolve("test");
      assertThat(checked.get()).isGreaterThanOrEqualTo(2);
      assertThat(blocked.get()).isZero();

    } finally {
      Logger.clearConnectors();
    }
  }

  @Test
  public void loopExecutorLongChain() {
    final AtomicReference<Resolver<Integer>> resolver = new AtomicReference<Resolver<Integer>>();
    final Promise<Integer> first =
        new Pact().on(loopExecutor()).promise(pending(resolver, new AtomicReference<Rejecter>()));
    Promise<Integer> promise = first;
    for (int i = 0; i < 10000; ++i) {
      promise = promise.then(new Mapper<Integer, Integer>() {

        public Integer apply(final Integer input) {
          return input + 1;
        }
      });
    }

    resolver.get().resolve(0);
    assertThat(promise.value()).isEqualTo(10000);
  }

  @Test(expected = NullPointerException.class)
  @SuppressWarnings("ConstantConditions")
  public void nullFinallyException() {
    new Pact().resolved(1).thenFinally(null);
  }

  @Test(expected = NullPointerException.class)
  @SuppressWarnings("ConstantConditions")
  public void nullRejectException() {
    new Pact().resolved(1).then(doubled(), null);
  }

  @Test(expected = NullPointerException.class)
  @SuppressWarnings("ConstantConditions")
  public void nullThenException() {
    new Pact().resolved(1).then(null);
  }

  @Test
  public void reasonOnRejected() {
    final IOException reason = new IOException("test");
    final Promise<String> promise = new Pact().rejected(reason);
    assertThat(promise.getState()).isEqualTo(SettlementState.Rejected);
    assertThat(promise.reason()).isSameAs(reason);
    try {
      promise.value();

    } catch (final RejectionException e) {
      assertThat(e.getCause()).isSameAs(reason);
      assertThat(e.getMessage()).isEqualTo("test");
      return;
    }

    throw new AssertionError();
  }

  @Test(expected = IllegalStateException.class)
  public void reasonOnFulfilledException() {
    new Pact().resolved("test").reason();
  }

  @Test
  public void recoverRejection() {
    final Promise<Integer> promise =
        new Pact().<Integer>rejected(new IOException()).then(doubled());
    assertThat(promise.thenCatch(new Mapper<Throwable, Integer>() {

      public Integer apply(final Throwable input) {
        return 84;
      }
    }).value()).isEqualTo(84);
  }

  @Test
  public void recoverTaskFailure() {
    final Promise<Integer> promise = new Pact().promise(new Task<Integer>() {

      public void perform(@NotNull final Resolver<Integer> resolver,
          @NotNull final Rejecter rejecter) {
        throw new IllegalArgumentException();
      }
    });
    assertThat(promise.reason()).isExactlyInstanceOf(IllegalArgumentException.class);
    assertThat(promise.thenCatch(new Mapper<Throwable, Integer>() {

      public Integer apply(final Throwable input) {
        return 99;
      }
    }).value()).isEqualTo(99);
  }

  @Test
  public void rejectionHandlerFailure() {
    final IllegalStateException failure = new IllegalStateException();
    final Promise<Integer> promise =
        new Pact().<Integer>rejected(new IOException()).then(doubled(),
            new Mapper<Throwable, Integer>() {

              public Integer apply(final Throwable input) {
                throw failure;
              }
            });
    assertThat(promise.reason()).isSameAs(failure);
  }

  @Test
  public void scheduleOn() throws InterruptedException {
    final AtomicReference<Thread> thread = new AtomicReference<Thread>();
    final CountDownLatch latch = new CountDownLatch(1);
    new Pact().resolved("test").scheduleOn(threadExecutor()).thenDo(new Observer<String>() {

      public void accept(final String input) {
        thread.set(Thread.currentThread());
        latch.countDown();
      }
    });
    assertThat(latch.await(10, SECONDS)).isTrue();
    assertThat(thread.get()).isNotSameAs(Thread.currentThread());
  }

  @Test
  public void secondSettlementInsideTask() {
    final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
    final Promise<String> promise = new Pact().promise(new Task<String>() {

      public void perform(@NotNull final Resolver<String> resolver,
          @NotNull final Rejecter rejecter) {
        resolver.resolve("first");
        try {
          rejecter.reject(new IOException());

        } catch (final IllegalStateException e) {
          failure.set(e);
        }
      }
    });
    assertThat(failure.get()).isExactlyInstanceOf(IllegalStateException.class);
    assertThat(promise.value()).isEqualTo("first");
  }

  @Test
  public void thenCatchSkippedOnFulfillment() {
    final AtomicBoolean isCalled = new AtomicBoolean();
    final Promise<String> promise =
        new Pact().resolved("test").thenCatch(new Mapper<Throwable, String>() {

          public String apply(final Throwable input) {
            isCalled.set(true);
            return "recovered";
          }
        });
    assertThat(promise.value()).isEqualTo("test");
    assertThat(isCalled.get()).isFalse();
  }

  @Test
  public void unitChain() {
    final AtomicReference<Object> received = new AtomicReference<Object>("none");
    final Promise<String> promise =
        new Pact().resolved("test").thenDo(new Observer<String>() {

          public void accept(final String input) {
          }
        }).then(new Mapper<Void, String>() {

          public String apply(final Void input) {
            received.set(input);
            return "done";
          }
        });
    assertThat(received.get()).isNull();
    assertThat(promise.value()).isEqualTo("done");
  }

  @Test(expected = IllegalStateException.class)
  public void valueOnPendingException() {
    new Pact().promise(
        pending(new AtomicReference<Resolver<String>>(), new AtomicReference<Rejecter>())).value();
  }

  private static class LockCheckPrinter implements LogPrinter {

    private final AtomicInteger mBlocked;

    private final AtomicInteger mChecked;

    private final AtomicReference<Promise<String>> mPromise;

    private LockCheckPrinter(@NotNull final AtomicReference<Promise<String>> promise,
        @NotNull final AtomicInteger checked, @NotNull final AtomicInteger blocked) {
      mPromise = promise;
      mChecked = checked;
      mBlocked = blocked;
    }

    public boolean canLogDbg() {
      return true;
    }

    public boolean canLogErr() {
      return false;
    }

    public boolean canLogWrn() {
      return false;
    }

    public void dbg(@Nullable final String message, @Nullable final Throwable throwable) {
      final Promise<String> promise = mPromise.get();
      if ((promise == null) || (message == null) || !(message.contains("Resolving promise")
          || message.contains("Registering continuation"))) {
        return;
      }

      // the state of the promise must be readable from another thread
      final Thread thread = new Thread() {

        @Override
        public void run() {
          promise.getState();
        }
      };
      thread.start();
      try {
        thread.join(5000);

      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }

      mChecked.incrementAndGet();
      if (thread.isAlive()) {
        mBlocked.incrementAndGet();
      }
    }

    public void err(@Nullable final String message, @Nullable final Throwable throwable) {
    }

    public void wrn(@Nullable final String message, @Nullable final Throwable throwable) {
    }
  }
}
