package com.apisite.checker.probe.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the ordered list of URLs tried for one endpoint. Earlier entries win when several
 * would validate.
 */
public final class CandidateUrlBuilder {
  public static final List<String> QUERY_VARIANTS = List.of(
      "ac=detail&pg=1",
      "ac=list&pg=1",
      "limit=1"
  );

  private CandidateUrlBuilder() {}

  public static List<String> candidates(String baseUrl) {
    String base = baseUrl == null ? "" : baseUrl.trim();
    List<String> urls = new ArrayList<>(QUERY_VARIANTS.size() + 1);
    for (String query : QUERY_VARIANTS) {
      urls.add(appendQuery(base, query));
    }
    urls.add(base);
    return List.copyOf(urls);
  }

  static String appendQuery(String base, String query) {
    if (base.endsWith("?") || base.endsWith("&")) {
      return base + query;
    }
    return base + (base.contains("?") ? "&" : "?") + query;
  }
}
