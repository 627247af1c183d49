package com.ospicorp.priceapi.market;

import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "markets")
public class Market {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;
  private String name;
  private String county;
  private Double lat;
  private Double lon;

  public Market() {
    // JPA default constructor
  }

  public Market(String name, String county, Double lat, Double lon) {
    this.name = name;
    this.county = county;
    this.lat = lat;
    this.lon = lon;
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getCounty() {
    return county;
  }

  public Double getLat() {
    return lat;
  }

  public Double getLon() {
    return lon;
  }

  public boolean hasCoordinates() {
    return lat != null && lon != null;
  }
}
