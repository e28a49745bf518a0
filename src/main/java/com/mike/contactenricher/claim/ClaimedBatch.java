package com.mike.contactenricher.claim;

import lombok.Value;

import java.util.List;

@Value
public class ClaimedBatch<T> {

    List<WorkItem> items;

    T result;

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
