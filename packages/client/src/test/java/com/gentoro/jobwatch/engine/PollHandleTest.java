package com.gentoro.jobwatch.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.jobwatch.support.ManualTaskScheduler;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PollHandleTest {

  @Test
  @DisplayName("cancel drops the armed tick")
  void cancelDropsArmedTick() {
    var scheduler = new ManualTaskScheduler();
    var fired = new AtomicInteger();
    var handle = new PollHandle();

    handle.arm(scheduler.schedule(fired::incrementAndGet, 100));
    assertTrue(handle.isArmed());

    handle.cancel();
    assertFalse(handle.isArmed());
    assertTrue(handle.isCancelled());

    scheduler.advanceBy(200);
    assertEquals(0, fired.get());
  }

  @Test
  @DisplayName("arming after cancel cancels the new task at once")
  void armAfterCancel() {
    var scheduler = new ManualTaskScheduler();
    var fired = new AtomicInteger();
    var handle = new PollHandle();
    handle.cancel();

    handle.arm(scheduler.schedule(fired::incrementAndGet, 50));

    assertFalse(handle.isArmed());
    scheduler.advanceBy(100);
    assertEquals(0, fired.get());
  }

  @Test
  @DisplayName("a fired tick leaves the handle disarmed until re-armed")
  void firedDisarms() {
    var scheduler = new ManualTaskScheduler();
    var handle = new PollHandle();
    handle.arm(scheduler.schedule(handle::fired, 10));

    scheduler.advanceBy(10);

    assertFalse(handle.isArmed());
    assertFalse(handle.isCancelled());
  }
}
