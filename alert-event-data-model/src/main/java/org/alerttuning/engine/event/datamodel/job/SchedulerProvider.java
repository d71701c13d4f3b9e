package org.alerttuning.engine.event.datamodel.job;

import java.util.Properties;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;

/** Builds in-memory Quartz schedulers, one per named component. */
public class SchedulerProvider {
  static final String SKIP_UPDATE_CHECK = "org.quartz.scheduler.skipUpdateCheck";

  private SchedulerProvider() {}

  public static Scheduler newScheduler(String instanceName, int threadCount)
      throws SchedulerException {
    Properties properties = new Properties();
    properties.setProperty(StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, instanceName);
    properties.setProperty(SKIP_UPDATE_CHECK, "true");
    properties.setProperty(
        StdSchedulerFactory.PROP_THREAD_POOL_CLASS, "org.quartz.simpl.SimpleThreadPool");
    properties.setProperty("org.quartz.threadPool.threadCount", String.valueOf(threadCount));
    properties.setProperty(
        StdSchedulerFactory.PROP_JOB_STORE_CLASS, "org.quartz.simpl.RAMJobStore");
    return new StdSchedulerFactory(properties).getScheduler();
  }
}
