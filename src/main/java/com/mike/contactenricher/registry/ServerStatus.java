package com.mike.contactenricher.registry;

public enum ServerStatus {
    ONLINE("online"),
    OFFLINE("offline"),
    ERROR("error");

    private final String dbValue;

    ServerStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }
}
