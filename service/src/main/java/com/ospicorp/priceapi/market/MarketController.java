package com.ospicorp.priceapi.market;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/markets")
@Tag(name = "Markets")
public class MarketController {
  private final MarketService marketService;

  public MarketController(MarketService marketService) {
    this.marketService = marketService;
  }

  @GetMapping
  @Operation(summary = "List markets", description = "All registered markets with their latest price.")
  public Map<String, Object> list() {
    List<MarketSummary> markets = marketService.listWithLatestPrices();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("markets", markets);
    body.put("count", markets.size());
    return body;
  }
}
