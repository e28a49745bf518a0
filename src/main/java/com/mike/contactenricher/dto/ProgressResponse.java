package com.mike.contactenricher.dto;

import com.mike.contactenricher.pool.PoolStats;
import com.mike.contactenricher.sink.SinkStats;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProgressResponse {
    String serverId;
    boolean running;

    long total;
    long pending;
    long completed;
    double percentComplete;

    SinkStats sink;
    PoolStats pool;
}
