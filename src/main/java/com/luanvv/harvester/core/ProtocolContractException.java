package com.luanvv.harvester.core;

import lombok.Getter;

@Getter
public class ProtocolContractException extends CrawlException {
    private final String url;
    private final String payload;

    public ProtocolContractException(String url, String message) {
        this(url, message, (String) null);
    }

    public ProtocolContractException(String url, String message, String payload) {
        super(message + " (" + url + ")" + (payload == null ? "" : ": " + abbreviate(payload)));
        this.url = url;
        this.payload = payload;
    }

    public ProtocolContractException(String url, String message, Throwable cause) {
        super(message + " (" + url + ")", cause);
        this.url = url;
        this.payload = null;
    }

    private static String abbreviate(String s) {
        return s.length() > 500 ? s.substring(0, 500) + "..." : s;
    }
}
