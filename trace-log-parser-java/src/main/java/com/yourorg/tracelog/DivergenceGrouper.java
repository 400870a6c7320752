package com.yourorg.tracelog;

import java.util.*;

/**
 * Buckets ranks by signature. Used for compile ids, cache sequences, collective schedules and
 * tensor metadata alike.
 */
public class DivergenceGrouper {

  /**
   * Groups {@code rank -> signature}. Ranks inside a group are ascending and groups are ordered by
   * their lowest rank.
   */
  public static DivergenceGrouping group(Map<Integer, String> signatures) {
    Map<String, List<Integer>> bySignature = new HashMap<>();
    for (var e : signatures.entrySet()) {
      bySignature.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey());
    }
    List<DivergenceGroup> groups = new ArrayList<>();
    for (var e : bySignature.entrySet()) {
      List<Integer> ranks = new ArrayList<>(e.getValue());
      Collections.sort(ranks);
      groups.add(new DivergenceGroup(e.getKey(), ranks));
    }
    groups.sort(Comparator.comparing(g -> g.ranks.get(0)));
    return new DivergenceGrouping(groups);
  }

  public static DivergenceGrouping byCompileIds(List<RankMetadata> ranks) {
    Map<Integer, String> sig = new TreeMap<>();
    for (RankMetadata md : ranks) sig.put(md.rank, md.compileIdSignature());
    return group(sig);
  }

  public static DivergenceGrouping byCacheSequence(List<RankMetadata> ranks) {
    Map<Integer, String> sig = new TreeMap<>();
    for (RankMetadata md : ranks) sig.put(md.rank, md.cacheSequence);
    return group(sig);
  }

  /**
   * Per rank, the op names of its schedules in graph order joined by {@code ,}. A rank with no
   * schedule gets the empty signature; with no schedules at all nothing is grouped.
   */
  public static DivergenceGrouping byCollectiveSchedule(List<CollectiveSchedule> schedules, List<Integer> ranks) {
    if (schedules.isEmpty()) return new DivergenceGrouping(new ArrayList<>());
    List<CollectiveSchedule> sorted = new ArrayList<>(schedules);
    sorted.sort(Comparator.comparing(s -> s.graph));
    Map<Integer, String> sig = new TreeMap<>();
    for (int rank : ranks) {
      List<String> ops = new ArrayList<>();
      for (CollectiveSchedule s : sorted) if (s.rank == rank) ops.addAll(s.ops);
      sig.put(rank, String.join(",", ops));
    }
    return group(sig);
  }

  /** Per rank, fingerprints in graph order joined by {@code ,}; ranks without any are left out. */
  public static DivergenceGrouping byTensorMeta(List<TensorMetaFingerprint> fingerprints) {
    Map<Integer, List<TensorMetaFingerprint>> byRank = new TreeMap<>();
    for (TensorMetaFingerprint f : fingerprints) byRank.computeIfAbsent(f.rank, k -> new ArrayList<>()).add(f);
    Map<Integer, String> sig = new TreeMap<>();
    for (var e : byRank.entrySet()) {
      List<TensorMetaFingerprint> l = new ArrayList<>(e.getValue());
      l.sort(Comparator.comparing(f -> f.graph));
      StringJoiner j = new StringJoiner(",");
      for (TensorMetaFingerprint f : l) j.add(f.fingerprint);
      sig.put(e.getKey(), j.toString());
    }
    return group(sig);
  }
}
