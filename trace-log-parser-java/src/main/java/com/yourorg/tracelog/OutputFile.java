package com.yourorg.tracelog;

/**
 * One entry of a compile directory bucket: a written artifact or an external link. Identity is
 * the bucket plus {@link #number}, the pass-wide sequence number.
 */
public class OutputFile {
  public String url;
  public String name;
  public int number;
  public String suffix;
  public String readableUrl;

  public OutputFile() {}

  public OutputFile(String url, String name, int number, String suffix, String readableUrl) {
    this.url = url;
    this.name = name;
    this.number = number;
    this.suffix = suffix;
    this.readableUrl = readableUrl;
  }
}
