package com.ospicorp.priceapi.market;

import java.time.Instant;

public record PriceObservation(String market, double priceKg, Instant observedAt, String source) {}
