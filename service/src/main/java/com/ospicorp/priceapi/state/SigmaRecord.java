package com.ospicorp.priceapi.state;

import java.time.Instant;

public record SigmaRecord(String location, double sigma, Instant lastUpdated) {}
