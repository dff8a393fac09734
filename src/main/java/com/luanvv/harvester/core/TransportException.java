package com.luanvv.harvester.core;

import lombok.Getter;

/**
 * A non-2xx reply or a network/timeout fault. {@code status} is -1 when no response arrived.
 */
@Getter
public class TransportException extends CrawlException {
    public static final int NO_RESPONSE = -1;

    private final String url;
    private final int status;

    public TransportException(String url, int status, String message) {
        super(describe(url, status, message));
        this.url = url;
        this.status = status;
    }

    public TransportException(String url, String message, Throwable cause) {
        super(describe(url, NO_RESPONSE, message), cause);
        this.url = url;
        this.status = NO_RESPONSE;
    }

    public boolean isClientError() {
        return status >= 400 && status < 500;
    }

    private static String describe(String url, int status, String message) {
        String prefix = status == NO_RESPONSE ? "Request failed" : "HTTP " + status;
        return prefix + " for " + url + (message == null || message.isBlank() ? "" : ": " + message);
    }
}
