package com.ospicorp.priceapi.market;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface MarketRepository extends JpaRepository<Market, Long> {

  Optional<Market> findByName(String name);

  @Query("SELECT m FROM Market m WHERE m.lat IS NOT NULL AND m.lon IS NOT NULL ORDER BY m.name")
  List<Market> findAllWithCoordinates();

  List<Market> findAllByOrderByNameAsc();
}
