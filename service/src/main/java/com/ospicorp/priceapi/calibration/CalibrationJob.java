package com.ospicorp.priceapi.calibration;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CalibrationJob {

  private static final Logger log = LoggerFactory.getLogger(CalibrationJob.class);

  private final CalibrationService calibrationService;
  private final Executor executor;
  // One run at a time: concurrent runs would race on the same sigma rows. Not owner-bound, so
  // a permit taken by the caller can be released by the worker thread.
  private final Semaphore runPermit = new Semaphore(1);
  private final AtomicReference<CalibrationReport> lastReport = new AtomicReference<>();

  public CalibrationJob(CalibrationService calibrationService,
      @Qualifier("applicationTaskExecutor") Executor executor) {
    this.calibrationService = calibrationService;
    this.executor = executor;
  }

  @Scheduled(cron = "${pricing.calibration.cron:0 0 2 * * *}", zone = "UTC")
  public void scheduledRun() {
    runExclusive("schedule");
  }

  // Starts a run in the background; false, and nothing started, while another run is active
  public boolean trySubmit(String trigger) {
    if (!runPermit.tryAcquire()) {
      log.warn("Calibration triggered by {} refused: another run is in progress", trigger);
      return false;
    }
    try {
      executor.execute(() -> {
        try {
          run(trigger);
        } finally {
          runPermit.release();
        }
      });
    } catch (RuntimeException ex) {
      runPermit.release();
      throw ex;
    }
    return true;
  }

  public Optional<CalibrationReport> runExclusive(String trigger) {
    if (!runPermit.tryAcquire()) {
      log.warn("Calibration triggered by {} skipped: another run is in progress", trigger);
      return Optional.empty();
    }
    try {
      return Optional.of(run(trigger));
    } finally {
      runPermit.release();
    }
  }

  private CalibrationReport run(String trigger) {
    log.info("Calibration run started by {}", trigger);
    CalibrationReport report = calibrationService.calibrateAll();
    lastReport.set(report);
    return report;
  }

  public Optional<CalibrationReport> lastReport() {
    return Optional.ofNullable(lastReport.get());
  }
}
