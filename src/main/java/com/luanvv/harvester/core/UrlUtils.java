package com.luanvv.harvester.core;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public class UrlUtils {

  public static final Map<String, String> REPLACEMENTS = Map.of(
      " ", "%20",
      "\\[", "%5B",
      "]", "%5D"
  );

  public static URI toAbsolute(String baseUrl, String href) {
    if (href == null || href.isBlank()) {
      return null;
    }
    try {
      URI base = new URI(baseUrl);
      return base.resolve(urlEncode(href.trim()));
    } catch (URISyntaxException | IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid URL: " + href, e);
    }
  }

  public static String urlEncode(String s) {
    for (Map.Entry<String, String> e : REPLACEMENTS.entrySet()) {
      s = s.replaceAll(e.getKey(), e.getValue());
    }
    return s;
  }

  /** Appends {@code name=value}, choosing {@code ?} or {@code &} by whether a query is present. */
  public static String withQueryParam(String url, String name, Object value) {
    String joiner = url.contains("?") ? "&" : "?";
    return url + joiner + encodeParam(name) + "=" + encodeParam(String.valueOf(value));
  }

  private static String encodeParam(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8);
  }
}
