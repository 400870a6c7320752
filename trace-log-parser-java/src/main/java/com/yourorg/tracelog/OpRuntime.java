package com.yourorg.tracelog;

public class OpRuntime {
  public String name;
  public double estimatedRuntimeNs;

  public OpRuntime() {}

  public OpRuntime(String name, double estimatedRuntimeNs) {
    this.name = name;
    this.estimatedRuntimeNs = estimatedRuntimeNs;
  }
}
