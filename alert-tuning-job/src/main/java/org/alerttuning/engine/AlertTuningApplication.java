package org.alerttuning.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Arrays;
import org.alerttuning.engine.event.datamodel.job.JobManager;
import org.alerttuning.engine.event.datamodel.job.SchedulerProvider;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the alert tuning pipeline on its cron schedule, or a single time when started with
 * {@code --once}.
 */
public class AlertTuningApplication {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertTuningApplication.class);

  static final String RUN_ONCE_FLAG = "--once";

  private final Scheduler scheduler;
  private final JobManager jobManager;

  public AlertTuningApplication(Config appConfig, AlertTuningPipeline pipeline) {
    try {
      scheduler = SchedulerProvider.newScheduler(AlertTuningJobConstants.JOB_NAME, 1);
      jobManager = new AlertTuningJobManager(pipeline);
      jobManager.initJob(appConfig);
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  public void start() {
    try {
      jobManager.startJob(scheduler);
      scheduler.start();
      LOGGER.info("Alert tuning job started");
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  public void stop() {
    try {
      jobManager.stopJob(scheduler);
      scheduler.shutdown(true);
      LOGGER.info("Alert tuning job stopped");
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  public static void main(String[] args) {
    Config appConfig = ConfigFactory.load();
    AlertTuningPipeline pipeline = new AlertTuningPipeline(appConfig);

    if (Arrays.asList(args).contains(RUN_ONCE_FLAG)) {
      pipeline
          .run()
          .ifPresentOrElse(
              result -> LOGGER.info("Outputs written to {}", pipeline.getOutputDir()),
              () -> LOGGER.warn("No alert data available, nothing written"));
      return;
    }

    AlertTuningApplication application = new AlertTuningApplication(appConfig, pipeline);
    Runtime.getRuntime().addShutdownHook(new Thread(application::stop, "alert-tuning-shutdown"));
    application.start();
  }
}
