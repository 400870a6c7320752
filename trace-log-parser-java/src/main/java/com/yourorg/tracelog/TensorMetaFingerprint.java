package com.yourorg.tracelog;

/** Compact re-serialization of a graph's tensor metadata; equal text means equal metadata. */
public class TensorMetaFingerprint {
  public int rank;
  public String graph;
  public String fingerprint;

  public TensorMetaFingerprint() {}

  public TensorMetaFingerprint(int rank, String graph, String fingerprint) {
    this.rank = rank;
    this.graph = graph;
    this.fingerprint = fingerprint;
  }
}
