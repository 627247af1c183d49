package com.ospicorp.priceapi.pricing;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/prices")
@Tag(name = "Prices")
public class EstimateController {
  private final EstimateService estimateService;

  public EstimateController(EstimateService estimateService) {
    this.estimateService = estimateService;
  }

  @PostMapping("/estimate")
  @Operation(summary = "Estimate price",
      description = "Per-kg price estimate for a location with a confidence range and the "
          + "breakdown of every adjustment factor.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Estimate",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = EstimateResponse.class))),
      @ApiResponse(responseCode = "400", description = "Invalid payload",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Unknown location or no prices",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public EstimateResponse estimate(@Valid @RequestBody EstimateRequest request) {
    return estimateService.estimate(request);
  }
}
