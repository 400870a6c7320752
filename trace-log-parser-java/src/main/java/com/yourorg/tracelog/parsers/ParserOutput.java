package com.yourorg.tracelog.parsers;

import com.yourorg.tracelog.CompileId;

/** One thing a parser asks the aggregator to emit. */
public final class ParserOutput {

  public enum Kind {
    /** File under the compile directory, unique-suffixed with its sequence number. */
    FILE,
    /** File written as named, no suffix. */
    GLOBAL_FILE,
    /** Unique-suffixed file whose content is the record's payload. */
    PAYLOAD_FILE,
    /** Unique-suffixed file whose content is the payload run through a formatter. */
    PAYLOAD_REFORMAT_FILE,
    /** External link listed in the compile directory, nothing written. */
    LINK
  }

  public final Kind kind;
  public final String path;
  public final String content;
  public final PayloadFormatter formatter;
  public final String linkName;
  public final String linkUrl;

  private ParserOutput(Kind kind, String path, String content, PayloadFormatter formatter,
                       String linkName, String linkUrl) {
    this.kind = kind;
    this.path = path;
    this.content = content;
    this.formatter = formatter;
    this.linkName = linkName;
    this.linkUrl = linkUrl;
  }

  public static ParserOutput file(String path, String content) {
    return new ParserOutput(Kind.FILE, path, content, null, null, null);
  }

  public static ParserOutput globalFile(String path, String content) {
    return new ParserOutput(Kind.GLOBAL_FILE, path, content, null, null, null);
  }

  public static ParserOutput payloadFile(String path) {
    return new ParserOutput(Kind.PAYLOAD_FILE, path, null, null, null, null);
  }

  public static ParserOutput payloadReformatFile(String path, PayloadFormatter formatter) {
    return new ParserOutput(Kind.PAYLOAD_REFORMAT_FILE, path, null, formatter, null, null);
  }

  public static ParserOutput link(String name, String url) {
    return new ParserOutput(Kind.LINK, null, null, null, name, url);
  }

  /** {@code <compile dir>/<filename>}; records without a compile id land in {@code unknown_<lineno>}. */
  public static String compileFilePath(String filename, int lineno, CompileId compileId) {
    return CompileId.directoryFor(compileId, lineno) + "/" + filename;
  }
}
