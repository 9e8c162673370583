package com.marketgateway.marketdata.model;

import java.time.Instant;

public record Candle(
    Instant time,
    double open,
    double high,
    double low,
    double close,
    Double volume
) {}
