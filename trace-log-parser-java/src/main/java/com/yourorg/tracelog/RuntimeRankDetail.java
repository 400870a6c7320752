package com.yourorg.tracelog;

public class RuntimeRankDetail {
  public int rank;
  public double runtimeMs;

  public RuntimeRankDetail() {}

  public RuntimeRankDetail(int rank, double runtimeMs) {
    this.rank = rank;
    this.runtimeMs = runtimeMs;
  }
}
