package com.ospicorp.tsanalysis.series.cache;

import java.util.List;

public final class CacheKeys {
  private CacheKeys() {
  }

  public static String entity(String id) {
    return "entity:" + id;
  }

  public static String timeDomain(String id) {
    return entity(id) + ":time_domain";
  }

  public static String frequencyDomain(String id) {
    return entity(id) + ":frequency_domain";
  }

  public static List<String> all(String id) {
    return List.of(entity(id), timeDomain(id), frequencyDomain(id));
  }
}
