package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import com.yourorg.tracelog.Html;
import com.yourorg.tracelog.Json;
import java.util.List;

/** Generated kernel source, named after the module file it was written to when known. */
public class InductorOutputCodeParser implements StructuredLogParser {
  private final boolean plainText;

  public InductorOutputCodeParser(boolean plainText) {
    this.plainText = plainText;
  }

  @Override
  public String name() {
    return "inductor_output_code";
  }

  @Override
  public JsonNode metadata(Envelope e) {
    return e.field("inductor_output_code");
  }

  @Override
  public List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload) {
    String ext = plainText ? ".txt" : ".html";
    String source = Json.textAt(metadata, "filename");
    String stem = source != null ? FileOutputs.fileStem(source) : null;
    String filename = stem != null ? "inductor_output_code_" + stem + ext : "inductor_output_code" + ext;

    if (plainText) {
      return FileOutputs.payload(filename, lineno, compileId);
    }
    return FileOutputs.file(filename, lineno, compileId, "<html><body>\n" + Html.pre(payload) + "\n</body></html>\n");
  }
}
