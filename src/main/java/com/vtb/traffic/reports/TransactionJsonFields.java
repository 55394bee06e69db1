package com.vtb.traffic.reports;

/**
 * Имена полей JSON-экспорта. Совпадают с колонками хранилища.
 */
final class TransactionJsonFields {

    static final String ID = "id";
    static final String TIMESTAMP = "timestamp";
    static final String METHOD = "method";
    static final String URL = "url";
    static final String HOST = "host";
    static final String PATH = "path";
    static final String PROTOCOL = "protocol";
    static final String REQUEST_HEADERS = "request_headers";
    static final String REQUEST_BODY = "request_body";
    static final String REQUEST_BODY_TRUNCATED = "request_body_truncated";
    static final String RESPONSE_STATUS = "response_status";
    static final String RESPONSE_HEADERS = "response_headers";
    static final String RESPONSE_BODY = "response_body";
    static final String RESPONSE_BODY_TRUNCATED = "response_body_truncated";
    static final String DURATION = "duration";
    static final String ANALYZED = "analyzed";
    static final String NOTES = "notes";

    private TransactionJsonFields() {
    }
}
