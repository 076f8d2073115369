package com.supplier.resolution.core.model;

/**
 * Data-quality problems detected on a record, independent of the match outcome.
 */
public enum QualityFlag {
    MISSING_POSTCODE("missing_postcode"),
    MISSING_STREET("missing_street"),
    NO_WEB_PRESENCE("no_web_presence"),
    STALE_DATA("stale_data"),
    MISSING_COMPANY_TYPE("missing_company_type"),
    MALFORMED_INPUT("malformed_input");

    private final String code;

    QualityFlag(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
