package com.laddertrader.integration.nonkyc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class NonceGeneratorTest {
  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.ofEpochMilli(1_700_000_000_123L), ZoneOffset.UTC);

  @Test
  void shouldScaleMillisecondsByConfiguredMultiplier() {
    assertEquals(1_700_000_000_123L, new NonceGenerator(FIXED_CLOCK, BigDecimal.ONE).next());
    assertEquals(
        1_700_000_000_123_000L, new NonceGenerator(FIXED_CLOCK, new BigDecimal("1000")).next());
    assertEquals(1_700_000_000L, new NonceGenerator(FIXED_CLOCK, new BigDecimal("0.001")).next());
  }

  @Test
  void shouldIncrementWhenClockDoesNotAdvance() {
    NonceGenerator generator = new NonceGenerator(FIXED_CLOCK, BigDecimal.ONE);

    long first = generator.next();
    long second = generator.next();

    assertEquals(first + 1, second);
  }

  @Test
  void shouldStayMonotonicWhenClockMovesBackwards() {
    MutableClock clock = new MutableClock(Instant.ofEpochMilli(10_000L));
    NonceGenerator generator = new NonceGenerator(clock, BigDecimal.ONE);

    long first = generator.next();
    clock.advance(java.time.Duration.ofMillis(-5_000L));
    long second = generator.next();

    assertTrue(second > first);
  }

  @Test
  void shouldRejectNonPositiveMultiplier() {
    assertThrows(IllegalArgumentException.class, () -> new NonceGenerator(FIXED_CLOCK, BigDecimal.ZERO));
  }

  @Test
  void shouldProduceDistinctIncreasingNoncesAcrossThreads() throws Exception {
    NonceGenerator generator = new NonceGenerator(FIXED_CLOCK, BigDecimal.ONE);
    int threads = 8;
    int perThread = 2_000;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<Long>>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        Callable<List<Long>> task =
            () -> {
              start.await();
              List<Long> values = new ArrayList<>(perThread);
              for (int i = 0; i < perThread; i++) {
                values.add(generator.next());
              }
              return values;
            };
        futures.add(pool.submit(task));
      }
      start.countDown();

      Set<Long> all = new HashSet<>();
      for (Future<List<Long>> future : futures) {
        List<Long> values = future.get(10, TimeUnit.SECONDS);
        for (int i = 1; i < values.size(); i++) {
          assertTrue(values.get(i) > values.get(i - 1));
        }
        all.addAll(values);
      }
      assertEquals(threads * perThread, all.size());
    } finally {
      pool.shutdownNow();
    }
  }
}
