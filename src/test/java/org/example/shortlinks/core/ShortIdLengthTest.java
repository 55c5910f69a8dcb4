package org.example.shortlinks.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.Test;

class ShortIdLengthTest {

  @Test
  void raiseTo_onlyGrows() {
    ShortIdLength len = new ShortIdLength(4);

    assertEquals(6, len.raiseTo(6));
    assertEquals(6, len.raiseTo(5));
    assertEquals(6, len.get());
  }

  @Test
  void rejectsLengthBelowOne() {
    assertThrows(IllegalArgumentException.class, () -> new ShortIdLength(0));
  }

  @Test
  void concurrentRaisesKeepTheMaximum() throws Exception {
    ShortIdLength len = new ShortIdLength(1);
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> threads = new ArrayList<>();
    for (int i = 2; i <= 20; i++) {
      int target = i;
      Thread t =
          new Thread(
              () -> {
                try {
                  start.await();
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                  return;
                }
                len.raiseTo(target);
              });
      threads.add(t);
      t.start();
    }
    start.countDown();
    for (Thread t : threads) t.join();

    assertEquals(20, len.get());
  }
}
