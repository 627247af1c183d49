package com.ospicorp.priceapi.config;

import com.ospicorp.priceapi.market.Market;
import com.ospicorp.priceapi.market.MarketDistanceDao;
import com.ospicorp.priceapi.market.MarketPriceDao;
import com.ospicorp.priceapi.market.MarketRepository;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class DatabaseSeeder implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(DatabaseSeeder.class);
  private static final String SEED_SOURCE = "seed_data";
  private static final LocalTime OBSERVATION_TIME = LocalTime.of(9, 0);
  static final int SEED_DAYS = 45;

  private final MarketRepository marketRepository;
  private final MarketDistanceDao distanceDao;
  private final MarketPriceDao priceDao;
  private final Environment environment;
  private final Clock clock;
  private final boolean seedEnabled;
  private final Random random = new Random(8675309L);

  public DatabaseSeeder(MarketRepository marketRepository,
      MarketDistanceDao distanceDao,
      MarketPriceDao priceDao,
      Environment environment,
      Clock clock,
      @Value("${pricing.seed.enabled:true}") boolean seedEnabled) {
    this.marketRepository = marketRepository;
    this.distanceDao = distanceDao;
    this.priceDao = priceDao;
    this.environment = environment;
    this.clock = clock;
    this.seedEnabled = seedEnabled;
  }

  @Override
  @Transactional
  public void run(String... args) {
    if (!seedEnabled) {
      log.info("Database seeding disabled via property pricing.seed.enabled=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("prod"))) {
      log.info("Skipping database seeding because active profile includes prod");
      return;
    }
    long existing = marketRepository.count();
    if (existing > 0) {
      log.info("Database already contains {} markets; skipping seeding", existing);
      return;
    }
    seedDatabase();
  }

  private void seedDatabase() {
    log.info("Seeding database with reference markets and sample prices");
    List<SeedMarket> seeds = buildSeedDefinitions();

    List<Market> markets = new ArrayList<>(seeds.size());
    for (SeedMarket seed : seeds) {
      markets.add(new Market(seed.name(), seed.county(), seed.lat(), seed.lon()));
    }
    List<Market> saved = marketRepository.saveAll(markets);

    int distances = 0;
    for (SeedMarket seed : seeds) {
      for (var friction : seed.frictionMap().entrySet()) {
        distanceDao.save(seed.name(), friction.getKey(), friction.getValue());
        distances++;
      }
    }

    int points = 0;
    LocalDate today = LocalDate.now(clock);
    for (int i = 0; i < saved.size(); i++) {
      Market market = saved.get(i);
      double basePrice = seeds.get(i).basePrice();
      List<Object[]> rows = new ArrayList<>(SEED_DAYS);
      for (int daysAgo = SEED_DAYS; daysAgo > 0; daysAgo--) {
        // +/-15% around the market's base price
        double variation = 0.85 + random.nextDouble() * 0.30;
        double price = Math.round(basePrice * variation * 100.0) / 100.0;
        LocalDate day = today.minusDays(daysAgo);
        rows.add(new Object[]{
            market.getId(),
            Timestamp.from(day.atTime(OBSERVATION_TIME).toInstant(ZoneOffset.UTC)),
            price,
            SEED_SOURCE
        });
      }
      priceDao.recordBatch(rows);
      points += rows.size();
    }
    log.info("Inserted {} markets, {} distances and {} price observations",
        saved.size(), distances, points);
  }

  private List<SeedMarket> buildSeedDefinitions() {
    List<SeedMarket> seeds = new ArrayList<>();
    seeds.add(new SeedMarket("Nairobi", "Nairobi", -1.2921, 36.8219, 95.0,
        friction(0, 100, 80, 200, 150)));
    seeds.add(new SeedMarket("Nakuru", "Nakuru", -0.3031, 36.0800, 88.0,
        friction(100, 0, 60, 250, 80)));
    seeds.add(new SeedMarket("Nyeri", "Nyeri", -0.4167, 36.9500, 92.0,
        friction(80, 60, 0, 220, 120)));
    seeds.add(new SeedMarket("Mombasa", "Mombasa", -4.0435, 39.6682, 105.0,
        friction(200, 250, 220, 0, 300)));
    seeds.add(new SeedMarket("Eldoret", "Uasin Gishu", 0.5143, 35.2697, 85.0,
        friction(150, 80, 120, 300, 0)));
    return seeds;
  }

  // destination order: Nairobi, Nakuru, Nyeri, Mombasa, Eldoret
  private static Map<String, Double> friction(double nairobi, double nakuru, double nyeri,
      double mombasa, double eldoret) {
    Map<String, Double> map = new LinkedHashMap<>();
    map.put("Nairobi", nairobi);
    map.put("Nakuru", nakuru);
    map.put("Nyeri", nyeri);
    map.put("Mombasa", mombasa);
    map.put("Eldoret", eldoret);
    return map;
  }

  private record SeedMarket(String name, String county, double lat, double lon,
      double basePrice, Map<String, Double> frictionMap) {}
}
