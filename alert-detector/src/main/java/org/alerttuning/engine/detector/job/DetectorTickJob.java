package org.alerttuning.engine.detector.job;

import static org.alerttuning.engine.detector.job.DetectorJobConstants.JOB_DATA_MAP_DETECTOR;

import org.alerttuning.engine.detector.AlertDetector;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the detector's periodic check. The gap between the scheduled and the actual fire time is
 * passed on as the scheduler drift sample.
 */
@DisallowConcurrentExecution
public class DetectorTickJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectorTickJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    AlertDetector alertDetector =
        (AlertDetector) jobDetail.getJobDataMap().get(JOB_DATA_MAP_DETECTOR);

    long driftMillis = 0;
    if (jobExecutionContext.getFireTime() != null
        && jobExecutionContext.getScheduledFireTime() != null) {
      driftMillis =
          jobExecutionContext.getFireTime().getTime()
              - jobExecutionContext.getScheduledFireTime().getTime();
    }
    LOGGER.debug("Running detector check: {} drift:{}ms", jobDetail.getKey(), driftMillis);
    try {
      alertDetector.runPeriodicCheck(driftMillis);
    } catch (RuntimeException e) {
      LOGGER.error("Detector check failed", e);
    }
  }
}
