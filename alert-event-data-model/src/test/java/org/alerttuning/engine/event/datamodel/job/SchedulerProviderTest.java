package org.alerttuning.engine.event.datamodel.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.Test;
import org.quartz.Scheduler;

class SchedulerProviderTest {

  @Test
  void testBuildsNamedInMemoryScheduler() throws Exception {
    Scheduler scheduler = SchedulerProvider.newScheduler("scheduler-provider-test", 2);
    try {
      assertEquals("scheduler-provider-test", scheduler.getSchedulerName());
      assertEquals(2, scheduler.getMetaData().getThreadPoolSize());
      assertFalse(scheduler.getMetaData().isJobStoreSupportsPersistence());
    } finally {
      scheduler.shutdown();
    }
  }
}
