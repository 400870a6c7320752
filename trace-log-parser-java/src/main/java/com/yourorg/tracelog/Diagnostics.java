package com.yourorg.tracelog;

import java.util.*;

/** Everything the multi-rank landing page needs to say about cross-rank consistency. */
public class Diagnostics {

  public static class DivergenceFlags {
    public boolean cache;
    public boolean collective;
    public boolean tensorMeta;
    public boolean compileIds;
  }

  public static class ArtifactFlags {
    public boolean runtimeTrace;
  }

  public DivergenceFlags divergence = new DivergenceFlags();
  public ArtifactFlags artifacts = new ArtifactFlags();
  public RuntimeAnalysis analysis;

  // only filled for kinds that diverge
  public List<DivergenceGroup> cacheGroups = new ArrayList<>();
  public List<DivergenceGroup> collectiveGroups = new ArrayList<>();
  public List<DivergenceGroup> tensorMetaGroups = new ArrayList<>();
  public List<DivergenceGroup> compileIdGroups = new ArrayList<>();

  public boolean anyDivergence() {
    return divergence.cache || divergence.collective || divergence.tensorMeta || divergence.compileIds;
  }

  public static Diagnostics from(DivergenceGrouping compileIds, DivergenceGrouping cache,
                                 DivergenceGrouping collective, DivergenceGrouping tensorMeta,
                                 RuntimeAnalysis analysis, boolean runtimeTrace) {
    Diagnostics d = new Diagnostics();
    d.divergence.compileIds = compileIds.divergent;
    d.divergence.cache = cache.divergent;
    d.divergence.collective = collective.divergent;
    d.divergence.tensorMeta = tensorMeta.divergent;
    if (compileIds.divergent) d.compileIdGroups = new ArrayList<>(compileIds.groups);
    if (cache.divergent) d.cacheGroups = new ArrayList<>(cache.groups);
    if (collective.divergent) d.collectiveGroups = new ArrayList<>(collective.groups);
    if (tensorMeta.divergent) d.tensorMetaGroups = new ArrayList<>(tensorMeta.groups);
    d.analysis = analysis;
    d.artifacts.runtimeTrace = runtimeTrace;
    return d;
  }
}
