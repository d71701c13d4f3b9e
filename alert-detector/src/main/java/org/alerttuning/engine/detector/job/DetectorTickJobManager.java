package org.alerttuning.engine.detector.job;

import static org.alerttuning.engine.detector.job.DetectorJobConstants.JOB_DATA_MAP_DETECTOR;
import static org.alerttuning.engine.detector.job.DetectorJobConstants.JOB_GROUP;
import static org.alerttuning.engine.detector.job.DetectorJobConstants.JOB_NAME;
import static org.alerttuning.engine.detector.job.DetectorJobConstants.JOB_TRIGGER_NAME;

import com.typesafe.config.Config;
import org.alerttuning.engine.detector.AlertDetector;
import org.alerttuning.engine.detector.DetectorConfig;
import org.alerttuning.engine.event.datamodel.job.JobManager;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DetectorTickJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectorTickJobManager.class);

  private final AlertDetector alertDetector;
  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;

  public DetectorTickJobManager(AlertDetector alertDetector) {
    this.alertDetector = alertDetector;
  }

  @Override
  public void initJob(Config appConfig) {
    long checkInterval =
        appConfig
            .getConfig(DetectorConfig.DETECTOR_CONFIG)
            .getDuration("checkInterval")
            .toMillis();

    jobKey = JobKey.jobKey(JOB_NAME, JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_DETECTOR, alertDetector);

    jobDetail =
        JobBuilder.newJob(DetectorTickJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();

    jobTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(JOB_TRIGGER_NAME, JOB_GROUP)
            .startNow()
            .withSchedule(
                SimpleScheduleBuilder.simpleSchedule()
                    .withIntervalInMilliseconds(checkInterval)
                    .repeatForever()
                    .withMisfireHandlingInstructionNextWithRemainingCount())
            .build();
  }

  @Override
  public void startJob(Scheduler scheduler) throws SchedulerException {
    LOGGER.info("Schedule a job:{} with Trigger:{}", jobKey, jobTrigger);
    scheduler.scheduleJob(jobDetail, jobTrigger);
  }

  @Override
  public void stopJob(Scheduler scheduler) throws SchedulerException {
    if (scheduler.checkExists(jobKey)) {
      scheduler.deleteJob(jobKey);
    }
  }

  JobDetail getJobDetail() {
    return jobDetail;
  }

  Trigger getJobTrigger() {
    return jobTrigger;
  }
}
