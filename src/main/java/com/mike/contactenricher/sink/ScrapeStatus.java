package com.mike.contactenricher.sink;

public enum ScrapeStatus {
    SUCCESS("success"),
    NO_CONTACTS_FOUND("no_contacts_found"),
    FAILED("failed");

    private final String dbValue;

    ScrapeStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static ScrapeStatus fromDbValue(String value) {
        for (ScrapeStatus status : values()) {
            if (status.dbValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown scrape status: " + value);
    }
}
