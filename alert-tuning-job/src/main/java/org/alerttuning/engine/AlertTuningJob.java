package org.alerttuning.engine;

import static org.alerttuning.engine.AlertTuningJobConstants.JOB_DATA_MAP_PIPELINE;

import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@DisallowConcurrentExecution
public class AlertTuningJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertTuningJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    LOGGER.info("Starting alert tuning run: {}", jobDetail.getKey());

    AlertTuningPipeline pipeline =
        (AlertTuningPipeline) jobDetail.getJobDataMap().get(JOB_DATA_MAP_PIPELINE);
    try {
      pipeline.run();
    } catch (RuntimeException e) {
      LOGGER.error("Alert tuning run failed: {}", jobDetail.getKey(), e);
    }
  }
}
