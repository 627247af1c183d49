package com.ospicorp.priceapi.market;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class MarketService {
  private final MarketRepository marketRepository;
  private final MarketPriceDao priceDao;

  public MarketService(MarketRepository marketRepository, MarketPriceDao priceDao) {
    this.marketRepository = marketRepository;
    this.priceDao = priceDao;
  }

  public List<MarketSummary> listWithLatestPrices() {
    List<Market> markets = marketRepository.findAllByOrderByNameAsc();
    List<MarketSummary> out = new ArrayList<>(markets.size());
    for (Market market : markets) {
      MarketSummary.LatestPrice latest = priceDao.latest(market.getName())
          .map(p -> new MarketSummary.LatestPrice(p.priceKg(), p.observedAt(), p.source()))
          .orElse(null);
      out.add(new MarketSummary(market.getId(), market.getName(), market.getCounty(),
          market.getLat(), market.getLon(), latest));
    }
    return out;
  }
}
