package com.yourorg.tracelog;

/** Cache outcome implied by an artifact's filename, shown as a one-glyph suffix. */
public enum CacheStatus {
  NONE(""),
  HIT("✅"),
  MISS("❌"),
  BYPASS("❓");

  public final String glyph;

  CacheStatus(String glyph) {
    this.glyph = glyph;
  }

  public static CacheStatus fromFilename(String filename) {
    if (filename.contains("cache_miss")) return MISS;
    if (filename.contains("cache_hit")) return HIT;
    if (filename.contains("cache_bypass")) return BYPASS;
    return NONE;
  }
}
