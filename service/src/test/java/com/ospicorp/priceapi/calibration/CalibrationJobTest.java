package com.ospicorp.priceapi.calibration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class CalibrationJobTest {

  private static final CalibrationReport EMPTY =
      new CalibrationReport(Instant.EPOCH, Instant.EPOCH, List.of());

  @Test
  void keepsLastReport() {
    CalibrationService service = mock(CalibrationService.class);
    when(service.calibrateAll()).thenReturn(EMPTY);
    CalibrationJob job = new CalibrationJob(service, Runnable::run);

    assertThat(job.lastReport()).isEmpty();
    assertThat(job.runExclusive("test")).contains(EMPTY);
    assertThat(job.lastReport()).contains(EMPTY);
  }

  @Test
  void overlappingScheduledRunIsSkipped() throws Exception {
    CalibrationService service = mock(CalibrationService.class);
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(service.calibrateAll()).thenAnswer(inv -> {
      started.countDown();
      release.await(5, TimeUnit.SECONDS);
      return EMPTY;
    });
    CalibrationJob job = new CalibrationJob(service, Runnable::run);

    AtomicReference<Optional<CalibrationReport>> first = new AtomicReference<>();
    Thread worker = new Thread(() -> first.set(job.runExclusive("first")));
    worker.start();
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(job.runExclusive("second")).isEmpty();
    assertThat(job.trySubmit("admin")).isFalse();

    release.countDown();
    worker.join(5000);
    assertThat(first.get()).contains(EMPTY);
    verify(service, times(1)).calibrateAll();
  }

  @Test
  void submittedRunHoldsPermitUntilItFinishes() {
    CalibrationService service = mock(CalibrationService.class);
    when(service.calibrateAll()).thenReturn(EMPTY);
    List<Runnable> queued = new ArrayList<>();
    CalibrationJob job = new CalibrationJob(service, queued::add);

    assertThat(job.trySubmit("admin")).isTrue();
    // queued but not yet executed: a scheduled run in between must not start
    assertThat(job.runExclusive("schedule")).isEmpty();
    assertThat(job.trySubmit("admin")).isFalse();

    queued.get(0).run();

    assertThat(job.lastReport()).contains(EMPTY);
    assertThat(job.runExclusive("schedule")).contains(EMPTY);
    verify(service, times(2)).calibrateAll();
  }

  @Test
  void rejectedSubmissionReleasesPermit() {
    CalibrationService service = mock(CalibrationService.class);
    when(service.calibrateAll()).thenReturn(EMPTY);
    CalibrationJob job = new CalibrationJob(service, task -> {
      throw new RejectedExecutionException("pool saturated");
    });

    assertThatThrownBy(() -> job.trySubmit("admin"))
        .isInstanceOf(RejectedExecutionException.class);
    assertThat(job.runExclusive("schedule")).contains(EMPTY);
  }
}
