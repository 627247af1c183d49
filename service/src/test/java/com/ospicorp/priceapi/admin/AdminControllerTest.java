package com.ospicorp.priceapi.admin;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.priceapi.calibration.CalibrationJob;
import com.ospicorp.priceapi.calibration.CalibrationReport;
import com.ospicorp.priceapi.config.SecurityConfig;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AdminController.class)
@Import(SecurityConfig.class)
class AdminControllerTest {

  @Autowired
  private MockMvc mvc;

  @MockBean
  private CalibrationJob calibrationJob;

  @Test
  void startsCalibrationInBackground() throws Exception {
    when(calibrationJob.trySubmit("admin")).thenReturn(true);

    mvc.perform(post("/admin/calibration"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("calibration started"));

    verify(calibrationJob).trySubmit("admin");
  }

  @Test
  void refusesWhenRunCannotStart() throws Exception {
    when(calibrationJob.trySubmit("admin")).thenReturn(false);

    mvc.perform(post("/admin/calibration"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.status").value("calibration already running"));
  }

  @Test
  void lastReportIsEmptyBeforeFirstRun() throws Exception {
    when(calibrationJob.lastReport()).thenReturn(Optional.empty());

    mvc.perform(get("/admin/calibration/last"))
        .andExpect(status().isNoContent());
  }

  @Test
  void lastReportListsOutcomes() throws Exception {
    when(calibrationJob.lastReport()).thenReturn(Optional.of(new CalibrationReport(
        Instant.parse("2024-06-30T02:00:00Z"), Instant.parse("2024-06-30T02:00:03Z"), List.of())));

    mvc.perform(get("/admin/calibration/last"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.started_at").value("2024-06-30T02:00:00Z"))
        .andExpect(jsonPath("$.failed").isEmpty());
  }
}
