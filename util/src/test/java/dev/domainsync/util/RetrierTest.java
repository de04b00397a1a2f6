// Copyright 2026 The DomainSync Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package dev.domainsync.util;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link Retrier}. */
class RetrierTest {

  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final Retrier retrier = new Retrier(sleeper, 3, Duration.ofSeconds(1), 2);

  /** An exception to throw from {@link CountingThrower}. */
  static class CountingException extends RuntimeException {
    CountingException(int count) {
      super("" + count);
    }
  }

  /** Test object that always throws an exception with the current count. */
  static class CountingThrower implements Callable<Integer> {

    int count = 0;

    final int numThrows;

    CountingThrower(int numThrows) {
      this.numThrows = numThrows;
    }

    @Override
    public Integer call() {
      if (count == numThrows) {
        return numThrows;
      }
      count++;
      throw new CountingException(count);
    }
  }

  @Test
  void testRetryableException_exhaustsAttempts() {
    CountingException thrown =
        assertThrows(
            CountingException.class,
            () -> retrier.callWithRetry(new CountingThrower(5), CountingException.class));
    assertThat(thrown).hasMessageThat().isEqualTo("3");
    assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
  }

  @Test
  void testRetryableException_succeedsBeforeExhaustion() {
    assertThat(retrier.callWithRetry(new CountingThrower(2), CountingException.class))
        .isEqualTo(2);
    assertThat(sleeper.sleeps).hasSize(2);
  }

  @Test
  void testNonRetryableException_propagatesImmediately() {
    CountingException thrown =
        assertThrows(
            CountingException.class,
            () -> retrier.callWithRetry(new CountingThrower(5), IllegalStateException.class));
    assertThat(thrown).hasMessageThat().isEqualTo("1");
    assertThat(sleeper.sleeps).isEmpty();
  }

  @Test
  void testCheckedException_propagatedAsDeclaredType() {
    Callable<String> failing =
        () -> {
          throw new IOException("boom");
        };
    IOException thrown =
        assertThrows(
            IOException.class,
            () -> retrier.callWithRetry(failing, e -> e instanceof IOException, IOException.class));
    assertThat(thrown).hasMessageThat().isEqualTo("boom");
    assertThat(sleeper.sleeps).hasSize(2);
  }

  @Test
  void testCheckedException_wrappedWhenNotDeclared() {
    Callable<String> failing =
        () -> {
          throw new IOException("boom");
        };
    RuntimeException thrown =
        assertThrows(RuntimeException.class, () -> retrier.callWithRetry(failing, e -> false));
    assertThat(thrown).hasCauseThat().isInstanceOf(IOException.class);
  }

  @Test
  void testBackoff_growsByFactor() {
    Retrier fiveAttempts = new Retrier(sleeper, 5, Duration.ofMillis(100), 3);
    assertThat(fiveAttempts.backoffAfter(1)).isEqualTo(Duration.ofMillis(100));
    assertThat(fiveAttempts.backoffAfter(2)).isEqualTo(Duration.ofMillis(300));
    assertThat(fiveAttempts.backoffAfter(3)).isEqualTo(Duration.ofMillis(900));
  }

  @Test
  void testConstructor_rejectsNonPositiveAttempts() {
    assertThrows(
        IllegalArgumentException.class, () -> new Retrier(sleeper, 0, Duration.ofSeconds(1), 2));
  }

  private static class RecordingSleeper implements Sleeper {
    final List<Duration> sleeps = new ArrayList<>();

    @Override
    public void sleep(Duration duration) {
      sleeps.add(duration);
    }

    @Override
    public void sleepUninterruptibly(Duration duration) {
      sleeps.add(duration);
    }
  }
}
