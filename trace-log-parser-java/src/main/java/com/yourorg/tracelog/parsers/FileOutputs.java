package com.yourorg.tracelog.parsers;

import com.yourorg.tracelog.CompileId;
import java.util.*;

/** Single-output shortcuts shared by the simple handlers. */
final class FileOutputs {

  private FileOutputs() {}

  static List<ParserOutput> file(String filename, int lineno, CompileId cid, String content) {
    return List.of(ParserOutput.file(ParserOutput.compileFilePath(filename, lineno, cid), content));
  }

  static List<ParserOutput> payload(String filename, int lineno, CompileId cid) {
    return List.of(ParserOutput.payloadFile(ParserOutput.compileFilePath(filename, lineno, cid)));
  }

  static List<ParserOutput> reformatted(String filename, int lineno, CompileId cid, PayloadFormatter f) {
    return List.of(ParserOutput.payloadReformatFile(ParserOutput.compileFilePath(filename, lineno, cid), f));
  }

  /** Last path component without its final extension; null when nothing is left. */
  static String fileStem(String path) {
    String name = path.substring(path.lastIndexOf('/') + 1);
    if (name.isEmpty() || name.equals("..")) return null;
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
