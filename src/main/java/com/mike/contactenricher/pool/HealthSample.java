package com.mike.contactenricher.pool;

import lombok.Value;

import java.time.Instant;

@Value
public class HealthSample {
    Instant checkedAt;
    boolean healthy;
    double memoryMb;
    int openPageCount;
}
