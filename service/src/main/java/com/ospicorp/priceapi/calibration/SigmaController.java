package com.ospicorp.priceapi.calibration;

import com.ospicorp.priceapi.state.ModelStateDao;
import com.ospicorp.priceapi.state.SigmaRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.NoSuchElementException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/locations")
@Tag(name = "Calibration")
public class SigmaController {
  private final ModelStateDao stateDao;

  public SigmaController(ModelStateDao stateDao) {
    this.stateDao = stateDao;
  }

  @GetMapping("/{location}/sigma")
  @Operation(summary = "Get calibrated sigma",
      description = "Residual standard deviation last persisted for the location.")
  public SigmaRecord sigma(@PathVariable String location) {
    return stateDao.findSigma(location)
        .orElseThrow(() -> new NoSuchElementException("No sigma calibrated for " + location));
  }
}
