/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class WorkerPoolTest {

  @Mock private Worker first;
  @Mock private Worker second;

  private WorkerPool pool;

  @BeforeEach
  void setUp() {
    when(first.getWorkerId()).thenReturn("worker-0");
    when(first.getSlots()).thenReturn(2);
    when(second.getWorkerId()).thenReturn("worker-1");
    when(second.getSlots()).thenReturn(1);
    pool = new WorkerPool(List.of(first, second));
  }

  @Test
  void should_pick_the_least_loaded_worker() {
    assertSame(first, pool.acquire(Set.of()).orElseThrow());
    // both have one free slot now; ties go to the first worker
    assertSame(first, pool.acquire(Set.of()).orElseThrow());
    assertSame(second, pool.acquire(Set.of()).orElseThrow());
    assertEquals(0, pool.freeSlots());
    assertFalse(pool.acquire(Set.of()).isPresent());
  }

  @Test
  void should_avoid_excluded_workers_while_others_exist() {
    // Given
    pool.acquire(Set.of());
    pool.acquire(Set.of());

    // When / Then
    assertSame(second, pool.acquire(Set.of("worker-0")).orElseThrow());
    assertFalse(pool.acquire(Set.of("worker-1")).isPresent());
  }

  @Test
  void should_fall_back_to_an_excluded_worker_when_all_are_excluded() {
    assertSame(first, pool.acquire(Set.of("worker-0", "worker-1")).orElseThrow());
  }

  @Test
  void should_return_slots_on_release() {
    Worker worker = pool.acquire(Set.of()).orElseThrow();
    assertEquals(2, pool.freeSlots());

    pool.release(worker);
    pool.release(worker);

    assertEquals(3, pool.freeSlots());
  }

  @Test
  void should_shut_down_every_worker() {
    pool.shutdown();

    verify(first).shutdown();
    verify(second).shutdown();
  }

  @Test
  void should_reject_an_empty_pool() {
    assertThrows(IllegalArgumentException.class, () -> new WorkerPool(List.of()));
  }
}
