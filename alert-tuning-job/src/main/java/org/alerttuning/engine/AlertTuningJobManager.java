package org.alerttuning.engine;

import static org.alerttuning.engine.AlertTuningJobConstants.CRON_EXPRESSION;
import static org.alerttuning.engine.AlertTuningJobConstants.JOB_CONFIG;
import static org.alerttuning.engine.AlertTuningJobConstants.JOB_CONFIG_CRON_EXPRESSION;
import static org.alerttuning.engine.AlertTuningJobConstants.JOB_DATA_MAP_PIPELINE;
import static org.alerttuning.engine.AlertTuningJobConstants.JOB_GROUP;
import static org.alerttuning.engine.AlertTuningJobConstants.JOB_NAME;
import static org.alerttuning.engine.AlertTuningJobConstants.JOB_TRIGGER_NAME;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Map;
import org.alerttuning.engine.event.datamodel.job.JobManager;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AlertTuningJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertTuningJobManager.class);

  private final AlertTuningPipeline pipeline;
  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;

  public AlertTuningJobManager(AlertTuningPipeline pipeline) {
    this.pipeline = pipeline;
  }

  @Override
  public void initJob(Config appConfig) {
    Config jobConfig =
        appConfig.hasPath(JOB_CONFIG)
            ? appConfig.getConfig(JOB_CONFIG)
            : ConfigFactory.parseMap(Map.of());

    LOGGER.info("Alert tuning job config {}", jobConfig);

    jobKey = JobKey.jobKey(JOB_NAME, JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_PIPELINE, pipeline);

    jobDetail =
        JobBuilder.newJob(AlertTuningJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();

    String cronExpression =
        jobConfig.hasPath(JOB_CONFIG_CRON_EXPRESSION)
            ? jobConfig.getString(JOB_CONFIG_CRON_EXPRESSION)
            : CRON_EXPRESSION;
    jobTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(JOB_TRIGGER_NAME, JOB_GROUP)
            .withSchedule(CronScheduleBuilder.cronSchedule(cronExpression))
            .startNow()
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
