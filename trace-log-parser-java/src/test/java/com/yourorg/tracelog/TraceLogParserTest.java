package com.yourorg.tracelog;

import static com.yourorg.tracelog.TraceLines.*;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yourorg.tracelog.parsers.ParserOutput;
import com.yourorg.tracelog.parsers.StructuredLogParser;
import java.nio.file.*;
import java.util.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TraceLogParserTest {

  static final String CID_A = "{'frame_id': 0, 'frame_compile_id': 0, 'attempt': 0}";
  static final String CID_B = "{'frame_id': 1, 'frame_compile_id': 0, 'attempt': 0}";

  private static JsonNode json(String text) throws Exception {
    return Json.MAPPER.readTree(text);
  }

  /** Second handler on the same kind, writing its own payload file. */
  static class EchoParser implements StructuredLogParser {
    public String name() { return "echo"; }

    public JsonNode metadata(Envelope e) { return e.field("aot_forward_graph"); }

    public List<ParserOutput> parse(int lineno, JsonNode md, Integer rank, CompileId cid, String payload) {
      return List.of(ParserOutput.payloadFile(ParserOutput.compileFilePath("echo.txt", lineno, cid)));
    }
  }

  static class BoomParser implements StructuredLogParser {
    public String name() { return "boom"; }

    public JsonNode metadata(Envelope e) { return e.field("aot_forward_graph"); }

    public List<ParserOutput> parse(int lineno, JsonNode md, Integer rank, CompileId cid, String payload) {
      throw new IllegalStateException("boom");
    }
  }

  /** Asks for a reformatted payload whose formatter always fails. */
  static class BadFormatParser implements StructuredLogParser {
    private final String kind;

    BadFormatParser(String kind) {
      this.kind = kind;
    }

    public String name() { return "reformat"; }

    public JsonNode metadata(Envelope e) { return e.field(kind); }

    public List<ParserOutput> parse(int lineno, JsonNode md, Integer rank, CompileId cid, String payload) {
      return List.of(ParserOutput.payloadReformatFile(ParserOutput.compileFilePath("reformat.json", lineno, cid),
          p -> { throw new IllegalStateException("cannot reformat"); }));
    }
  }

  @Test
  void single_sentinel_record_lands_in_its_compile_directory() throws Exception {
    ParseOutput out = parse(recordWithPayload("{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}", "graph body"));
    Map<String, String> files = out.asMap();

    assertEquals("graph body", files.get("-_0_0_0/aot_forward_graph_0.txt"));
    assertEquals(1, out.stats.ok);
    assertEquals(0, out.stats.strictFailureTotal());

    JsonNode a = json(files.get("compile_directory.json")).get("[0/0]").get("artifacts").get(0);
    assertEquals("-_0_0_0/aot_forward_graph_0.txt", a.get("url").asText());
    assertEquals("aot_forward_graph_0.txt", a.get("name").asText());
    assertEquals(0, a.get("number").asInt());
    assertEquals("", a.get("suffix").asText());
    assertTrue(a.get("readable_url").isNull());

    List<ObjectNode> raw = rawRecords(out);
    assertEquals(1, raw.size());
    ObjectNode r = raw.get(0);
    assertEquals("-_0_0_0/aot_forward_graph_0.txt", r.get("payload_filename").asText());
    assertEquals(1234, r.get("thread").asLong());
    assertEquals("torch/_dynamo/convert_frame.py", r.get("pathname").asText());
    assertEquals(42, r.get("lineno").asLong());
    assertTrue(r.get("timestamp").asText().endsWith("-06-12T08:40:39.123456Z"));
    assertTrue(files.get("raw.jsonl").startsWith("{\"string_table\":[null]}\n"));
  }

  @Test
  void digest_mismatch_is_counted_but_payload_is_kept() throws Exception {
    ParseOutput out = parse(recordWithDigest("{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}",
        "graph body", "00000000000000000000000000000000"));
    assertEquals(1, out.stats.failPayloadMd5);
    assertEquals(1, out.stats.ok);
    assertEquals("graph body", out.asMap().get("-_0_0_0/aot_forward_graph_0.txt"));
  }

  @Test
  void lines_outside_the_grammar_are_skipped() throws Exception {
    ParseOutput out = parse(
        record("{'dynamo_start': {'stack': []}}"),
        "this is not a trace line",
        record("{'dynamo_start': {'stack': []}}"));
    assertEquals(1, out.stats.failGlog);
    assertEquals(2, out.stats.ok);
  }

  @Test
  void bad_json_is_dropped_but_bad_headers_still_reach_raw_jsonl() throws Exception {
    ParseOutput out = parse(
        PREFIX + "{not json",
        record("{'rank': 'zero', 'dynamo_start': {}}"));
    assertEquals(2, out.stats.failJson);
    assertEquals(0, out.stats.ok);
    List<ObjectNode> raw = rawRecords(out);
    assertEquals(1, raw.size());
    assertEquals("zero", raw.get(0).get("rank").asText());
  }

  @Test
  void first_rank_seen_sticks() throws Exception {
    ParseOutput out = parse(
        record("{'dynamo_start': {}}"),
        record("{'rank': 0, 'dynamo_start': {}}"),
        record("{'rank': 1, 'dynamo_start': {}}"),
        record("{'dynamo_start': {}}"),
        record("{'rank': 0, 'dynamo_start': {}}"));
    assertEquals(3, out.stats.ok);
    assertEquals(2, out.stats.otherRank);
    assertEquals(5, rawRecords(out).size());
  }

  @Test
  void interned_filenames_resolve_in_later_stacks() throws Exception {
    ParseOutput out = parse(
        record("{'str': ['/venv/site-packages/torch/a.py', 1]}"),
        record("{'dynamo_start': {'stack': [{'filename': 1, 'line': 3, 'name': 'f'}]}, 'compile_id': " + CID_A + "}"));
    Map<String, String> files = out.asMap();

    JsonNode stack = json(files.get("index.json")).get("stacks").get("[0/0]");
    assertEquals("torch/a.py:3 in f", stack.get(0).asText());
    assertTrue(files.get("raw.jsonl").startsWith("{\"string_table\":[null,\"/venv/site-packages/torch/a.py\"]}\n"));
    assertEquals(1, rawRecords(out).size());
    assertEquals(1, out.stats.ok);
  }

  @Test
  void every_matching_handler_runs_and_the_last_payload_file_wins() throws Exception {
    ParseConfig cfg = new ParseConfig();
    cfg.customParsers.add(new EchoParser());
    ParseOutput out = parse(cfg, recordWithPayload("{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}", "g"));
    Map<String, String> files = out.asMap();

    assertEquals("g", files.get("-_0_0_0/aot_forward_graph_0.txt"));
    assertEquals("g", files.get("-_0_0_0/echo_1.txt"));
    assertEquals("-_0_0_0/echo_1.txt", rawRecords(out).get(0).get("payload_filename").asText());
  }

  @Test
  void a_failing_handler_does_not_stop_the_others() throws Exception {
    ParseConfig cfg = new ParseConfig();
    cfg.customParsers.add(new BoomParser());
    ParseOutput out = parse(cfg,
        recordWithPayload("{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}", "g"),
        recordWithPayload("{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}", "h"));

    assertEquals(2, out.stats.failParser);
    assertEquals(Map.of("boom", 2L), out.stats.parserFailures);
    assertEquals("g", out.asMap().get("-_0_0_0/aot_forward_graph_0.txt"));
    assertEquals("h", out.asMap().get("-_0_0_0/aot_forward_graph_1.txt"));
  }

  @Test
  void guard_payload_problems_have_their_own_counter() throws Exception {
    ParseOutput out = parse(
        recordWithPayload("{'dynamo_guards': {}, 'compile_id': " + CID_A + "}", "not json"),
        recordWithPayload("{'dynamo_guards': {}, 'compile_id': " + CID_A + "}", "[{\"code\": \"x < 3\"}]"));
    assertEquals(1, out.stats.failDynamoGuardsJson);
    assertEquals(0, out.stats.failParser);
    assertTrue(out.asMap().get("-_0_0_0/dynamo_guards_0.html").contains("x &lt; 3"));
  }

  @Test
  void records_are_bucketed_by_compile_id_in_first_seen_order() throws Exception {
    ParseOutput out = parse(
        recordWithPayload("{'aot_forward_graph': {}, 'compile_id': {'frame_id': 0, 'frame_compile_id': 0}}", "a1"),
        recordWithPayload("{'aot_forward_graph': {}, 'compile_id': " + CID_B + "}", "b1"),
        recordWithPayload("{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}", "a2"));
    JsonNode dir = json(out.asMap().get("compile_directory.json"));

    assertEquals(List.of("[0/0]", "[1/0]"), fieldNames(dir));
    JsonNode a = dir.get("[0/0]").get("artifacts");
    assertEquals(2, a.size());
    assertEquals(0, a.get(0).get("number").asInt());
    assertEquals(2, a.get(1).get("number").asInt());
    assertEquals(1, dir.get("[1/0]").get("artifacts").get(0).get("number").asInt());
    assertEquals("b1", out.asMap().get("-_1_0_0/aot_forward_graph_1.txt"));
    assertEquals("a2", out.asMap().get("-_0_0_0/aot_forward_graph_2.txt"));
  }

  @Test
  void cache_outcomes_become_glyphs() throws Exception {
    ParseOutput out = parse(
        recordWithPayload("{'artifact': {'name': 'fx_graph_cache_miss', 'encoding': 'string'}, 'compile_id': " + CID_A + "}", "m"),
        recordWithPayload("{'artifact': {'name': 'fx_graph_cache_hit', 'encoding': 'string'}, 'compile_id': " + CID_A + "}", "h"),
        recordWithPayload("{'artifact': {'name': 'fx_graph_cache_bypass', 'encoding': 'json'}, 'compile_id': " + CID_A + "}", "{\"a\":1}"));
    JsonNode a = json(out.asMap().get("compile_directory.json")).get("[0/0]").get("artifacts");
    assertEquals("❌", a.get(0).get("suffix").asText());
    assertEquals("✅", a.get(1).get("suffix").asText());
    assertEquals("❓", a.get(2).get("suffix").asText());
    assertEquals("-_0_0_0/fx_graph_cache_bypass_2.json", a.get(2).get("url").asText());
    assertEquals(1, json(out.asMap().get("-_0_0_0/fx_graph_cache_bypass_2.json")).get("a").asInt());
  }

  @Test
  void links_take_a_sequence_number() throws Exception {
    ParseOutput out = parse(
        record("{'link': {'name': 'doc', 'url': 'http://example.com/x'}, 'compile_id': " + CID_A + "}"),
        recordWithPayload("{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}", "g"));
    JsonNode a = json(out.asMap().get("compile_directory.json")).get("[0/0]").get("artifacts");
    assertEquals("http://example.com/x", a.get(0).get("url").asText());
    assertEquals(0, a.get(0).get("number").asInt());
    assertTrue(out.asMap().containsKey("-_0_0_0/aot_forward_graph_1.txt"));
  }

  @Test
  void key_conflicts_drop_the_raw_line() throws Exception {
    ParseOutput out = parse(record("{'dynamo_start': {}, 'thread': 5}"));
    assertEquals(1, out.stats.failKeyConflict);
    assertEquals(1, out.stats.ok);
    assertEquals(1, out.stats.unknown);
    assertTrue(out.unknownFields.contains("thread"));
    assertTrue(rawRecords(out).isEmpty());
  }

  @Test
  void unclaimed_payloads_go_to_the_payloads_directory() throws Exception {
    String md5 = PayloadDigest.md5Hex("tensor info");
    ParseOutput out = parse(
        recordWithPayload("{'describe_tensor': {'id': 1}}", "tensor info"),
        recordWithPayload("{'describe_tensor': {'id': 2}}", ""));
    assertEquals("tensor info", out.asMap().get("payloads/" + md5 + ".txt"));
    List<ObjectNode> raw = rawRecords(out);
    assertEquals("payloads/" + md5 + ".txt", raw.get(0).get("payload_filename").asText());
    assertFalse(raw.get(1).has("payload_filename"));
  }

  @Test
  void chromium_events_are_collected_and_kept_out_of_raw_jsonl() throws Exception {
    ParseOutput out = parse(recordWithPayload("{'chromium_event': {}}", "{\"name\": \"compile\", \"ph\": \"B\"}"));
    JsonNode events = json(out.asMap().get("chromium_events.json"));
    assertEquals(1, events.size());
    assertEquals("compile", events.get(0).get("name").asText());
    assertTrue(rawRecords(out).isEmpty());
    assertTrue(out.paths().stream().noneMatch(p -> p.startsWith("payloads/")));
  }

  @Test
  void chromium_payload_that_is_not_json_fails_the_pass() {
    assertThrows(TraceLogException.class,
        () -> parse(recordWithPayload("{'chromium_event': {}}", "not json")));
  }

  @Test
  void compilation_metrics_take_the_recorded_specializations() throws Exception {
    ParseOutput out = parse(
        record("{'symbolic_shape_specialization': {'symbol': 's0', 'value': '3', 'sources': ['L[x].size()[0]']},"
            + " 'compile_id': " + CID_A + "}"),
        record("{'compilation_metrics': {'co_name': 'f', 'co_filename': 'm.py', 'co_firstlineno': 1,"
            + " 'restart_reasons': ['graph break']}, 'compile_id': " + CID_A + "}"),
        record("{'compilation_metrics': {}, 'compile_id': " + CID_A + "}"));
    Map<String, String> files = out.asMap();

    JsonNode first = json(files.get("-_0_0_0/compilation_metrics_0.json"));
    assertEquals("[0/0]", first.get("compile_id").asText());
    assertEquals("s0", first.get("symbolic_shape_specializations").get(0).get("symbol").asText());
    assertEquals("m.py:1 in f", first.get("mini_stack").get(0).asText());

    JsonNode second = json(files.get("-_0_0_0/compilation_metrics_1.json"));
    assertEquals(0, second.get("symbolic_shape_specializations").size());
    assertEquals("compilation_metrics_0.json", second.get("output_files").get(0).get("url").asText());

    JsonNode failures = json(files.get("failures_and_restarts.json"));
    assertEquals(1, failures.size());
    assertEquals("restart", failures.get(0).get("kind").asText());
    assertEquals("graph break", failures.get(0).get("reason").asText());
    assertEquals("-_0_0_0/compilation_metrics_0.json", failures.get(0).get("metrics_url").asText());
  }

  @Test
  void failures_need_a_reason() throws Exception {
    ParseOutput out = parse(record("{'compilation_metrics': {'fail_type': 'Unsupported', 'fail_reason': 'dynamic'},"
        + " 'compile_id': " + CID_A + "}"));
    JsonNode f = json(out.asMap().get("failures_and_restarts.json")).get(0);
    assertEquals("failure", f.get("kind").asText());
    assertEquals("Unsupported: dynamic (N/A:0)", f.get("reason").asText());

    assertThrows(TraceLogException.class,
        () -> parse(record("{'compilation_metrics': {'fail_type': 'Unsupported'}, 'compile_id': " + CID_A + "}")));
  }

  @Test
  void kernel_stack_traces_get_a_readable_page() throws Exception {
    ParseOutput out = parse(recordWithPayload(
        "{'artifact': {'name': 'inductor_provenance_tracking_kernel_stack_traces', 'encoding': 'json'},"
            + " 'compile_id': " + CID_A + "}",
        "{\"triton_poi_0\": [\"x = a<b\\\\ny = 2\"]}"));
    Map<String, String> files = out.asMap();
    String html = files.get("-_0_0_0/inductor_provenance_tracking_kernel_stack_traces_0_readable.html");
    assertNotNull(html);
    assertTrue(html.contains("<h3>triton_poi_0</h3>"));
    assertTrue(html.contains("<pre>x = a&lt;b\ny = 2</pre>"));

    JsonNode a = json(files.get("compile_directory.json")).get("[0/0]").get("artifacts").get(0);
    assertEquals("-_0_0_0/inductor_provenance_tracking_kernel_stack_traces_0_readable.html",
        a.get("readable_url").asText());
    // the readable page takes 0, the dump itself 1
    assertEquals(1, a.get("number").asInt());
    assertEquals(2, out.paths().stream().filter(p -> p.startsWith("-_0_0_0/")).count());
  }

  @Test
  void readable_page_numbering_leaves_room_for_the_next_artifact() throws Exception {
    ParseOutput out = parse(
        recordWithPayload("{'artifact': {'name': 'inductor_provenance_tracking_kernel_stack_traces', 'encoding': 'json'},"
            + " 'compile_id': " + CID_A + "}", "{}"),
        recordWithPayload("{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}", "g"));
    JsonNode a = json(out.asMap().get("compile_directory.json")).get("[0/0]").get("artifacts");
    assertEquals(1, a.get(0).get("number").asInt());
    assertEquals(2, a.get(1).get("number").asInt());
    assertEquals("g", out.asMap().get("-_0_0_0/aot_forward_graph_2.txt"));
  }

  @Test
  void a_failing_payload_formatter_is_isolated_to_its_handler() throws Exception {
    ParseConfig cfg = new ParseConfig();
    cfg.customParsers.add(new BadFormatParser("aot_forward_graph"));
    String json = "{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}";
    ParseOutput out = parse(cfg, recordWithPayload(json, "g"));
    Map<String, String> files = out.asMap();

    assertEquals(1, out.stats.failParser);
    assertEquals(Map.of("reformat", 1L), out.stats.parserFailures);
    assertEquals("g", files.get("-_0_0_0/aot_forward_graph_0.txt"));
    assertFalse(files.containsKey("-_0_0_0/reformat_1.json"));
    assertTrue(out.paths().stream().noneMatch(p -> p.contains("reformat")));
    assertEquals("-_0_0_0/aot_forward_graph_0.txt", rawRecords(out).get(0).get("payload_filename").asText());
  }

  @Test
  void a_failing_formatter_alone_falls_back_to_the_payloads_directory() throws Exception {
    ParseConfig cfg = new ParseConfig();
    // describe_tensor has no built-in payload handler
    cfg.customParsers.add(new BadFormatParser("describe_tensor"));
    ParseOutput out = parse(cfg, recordWithPayload("{'describe_tensor': {'id': 1}, 'compile_id': " + CID_A + "}", "t"));

    assertEquals(Map.of("reformat", 1L), out.stats.parserFailures);
    String fallback = "payloads/" + PayloadDigest.md5Hex("t") + ".txt";
    assertEquals("t", out.asMap().get(fallback));
    assertEquals(fallback, rawRecords(out).get(0).get("payload_filename").asText());
    assertTrue(out.paths().stream().noneMatch(p -> p.contains("reformat")));
  }

  @Test
  void a_record_missing_keys_after_a_good_payload_does_not_disturb_it() throws Exception {
    ParseOutput out = parse(
        recordWithPayload("{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}", "line one\nline two"),
        record("{'compile_id': " + CID_A + "}"));
    Map<String, String> files = out.asMap();

    assertEquals(0, out.stats.failPayloadMd5);
    assertEquals("line one\nline two", files.get("-_0_0_0/aot_forward_graph_0.txt"));
    long artifacts = out.paths().stream().filter(p -> p.startsWith("-_0_0_0/")).count();
    assertEquals(1, artifacts);
    assertEquals(1, json(files.get("compile_directory.json")).get("[0/0]").get("artifacts").size());
  }

  @Test
  void strict_mode_fails_on_any_parse_problem() throws Exception {
    ParseConfig cfg = new ParseConfig();
    cfg.strict = true;
    assertThrows(TraceLogException.class, () -> parse(cfg, "garbage", record("{'dynamo_start': {}}")));
    assertEquals(1, parse(cfg, record("{'dynamo_start': {}}")).stats.ok);
  }

  @Test
  void strict_compile_id_mode_fails_on_the_unknown_bucket() throws Exception {
    ParseConfig cfg = new ParseConfig();
    cfg.strictCompileId = true;
    assertThrows(TraceLogException.class, () -> parse(cfg, record("{'dynamo_start': {}}")));
    assertEquals(1, parse(cfg, record("{'dynamo_start': {}, 'compile_id': " + CID_A + "}")).stats.ok);
  }

  @Test
  void export_mode_reports_failures_and_guard_pages() throws Exception {
    ParseConfig cfg = new ParseConfig();
    cfg.export = true;
    ParseOutput out = parse(cfg,
        recordWithPayload("{'exported_program': {}, 'compile_id': " + CID_A + "}", "program"),
        record("{'missing_fake_kernel': {'op': 'mylib.foo'}}"),
        record("{'expression_created': {'result_id': 1, 'result': 's0 + 1', 'method': 'add',"
            + " 'arguments': ['s0', '1'], 'argument_ids': [2, 1]}}"),
        record("{'expression_created': {'result_id': 2, 'result': 's0', 'method': 'symbol'}}"),
        record("{'guard_added': {'prefix': 'eval', 'expr': 'Eq(s0 + 1, 4)', 'expr_node_id': 1},"
            + " 'compile_id': " + CID_A + "}"),
        record("{'guard_added': {'prefix': 'runtime_assert', 'expr': 'x', 'expr_node_id': 1}}"));
    Map<String, String> files = out.asMap();

    assertEquals("program", files.get("-_0_0_0/exported_program_0.txt"));
    assertTrue(files.get("-_0_0_0/symbolic_guard_information_1.html").contains("Eq(s0 + 1, 4)"));
    assertFalse(files.containsKey("compile_directory.json"));

    JsonNode failures = json(files.get("export_failures.json"));
    assertEquals(2, failures.size());
    assertEquals("Missing Fake Kernel", failures.get(0).get("failure_type").asText());
    assertEquals("Guard Evaluated", failures.get(1).get("failure_type").asText());
    assertTrue(failures.get(1).get("additional_info").asText().contains("-_0_0_0/symbolic_guard_information_1.html"));

    JsonNode index = json(files.get("index.json"));
    assertFalse(index.get("success").asBoolean());
    assertEquals("-_0_0_0/exported_program_0.txt", index.get("exported_program_url").asText());
  }

  @Test
  void guard_without_a_page_does_not_link_to_one() throws Exception {
    ParseConfig cfg = new ParseConfig();
    cfg.export = true;
    ParseOutput out = parse(cfg,
        recordWithPayload("{'exported_program': {}, 'compile_id': " + CID_A + "}", "program"),
        record("{'guard_added': {'prefix': 'eval', 'expr': 'Eq(s0, 4)'}, 'compile_id': " + CID_A + "}"));
    Map<String, String> files = out.asMap();

    assertEquals(Map.of("guard_added", 1L), out.stats.parserFailures);
    assertTrue(out.paths().stream().noneMatch(p -> p.contains("symbolic_guard_information")));
    JsonNode failure = json(files.get("export_failures.json")).get(0);
    assertEquals("Guard Evaluated", failure.get("failure_type").asText());
    String info = failure.get("additional_info").asText();
    assertFalse(info.contains(".html"));
    assertFalse(info.contains("exported_program"));
  }

  @Test
  void dynamo_start_and_bare_stacks_feed_the_stack_tries() throws Exception {
    ParseOutput out = parse(
        record("{'str': ['/venv/site-packages/torch/a.py', 1]}"),
        record("{'dynamo_start': {'stack': [{'filename': 1, 'line': 3, 'name': 'f'},"
            + " {'filename': 1, 'line': 9, 'name': 'g'}]}, 'compile_id': " + CID_A + "}"),
        record("{'dynamo_start': {'stack': [{'filename': 1, 'line': 3, 'name': 'f'}]}, 'compile_id': " + CID_B + "}"),
        record("{'compilation_metrics': {'fail_type': 'Unsupported', 'fail_reason': 'x'}, 'compile_id': " + CID_B + "}"),
        record("{'stack': [{'filename': 1, 'line': 5, 'name': 'h'}]}"));
    JsonNode index = json(out.asMap().get("index.json"));

    JsonNode f = index.get("stack_trie").get("children").get(0);
    assertEquals("torch/a.py:3 in f", f.get("frame").asText());
    assertEquals("[1/0]", f.get("compile_ids").get(0).get("id").asText());
    assertEquals("failed", f.get("compile_ids").get(0).get("status").asText());
    JsonNode g = f.get("children").get(0);
    assertEquals("torch/a.py:9 in g", g.get("frame").asText());
    assertEquals("[0/0]", g.get("compile_ids").get(0).get("id").asText());
    assertEquals("missing", g.get("compile_ids").get(0).get("status").asText());

    assertTrue(index.get("has_unknown_stack_trie").asBoolean());
    JsonNode h = index.get("unknown_stack_trie").get("children").get(0);
    assertEquals("torch/a.py:5 in h", h.get("frame").asText());
    assertEquals("(unknown)", h.get("compile_ids").get(0).get("id").asText());
  }

  @Test
  void without_bare_stacks_the_unknown_trie_is_empty() throws Exception {
    JsonNode index = json(parse(record("{'dynamo_start': {'stack': []}, 'compile_id': " + CID_A + "}"))
        .asMap().get("index.json"));
    assertFalse(index.get("has_unknown_stack_trie").asBoolean());
    assertEquals(0, index.get("unknown_stack_trie").get("children").size());
    assertEquals("[0/0]", index.get("stack_trie").get("compile_ids").get(0).get("id").asText());
  }

  @Test
  void provenance_mode_writes_a_page_per_compile_directory() throws Exception {
    ParseConfig cfg = new ParseConfig();
    cfg.inductorProvenance = true;
    String[] lines = {
        recordWithPayload("{'artifact': {'name': 'before_pre_grad_graph', 'encoding': 'string'}, 'compile_id': " + CID_A + "}",
            InductorProvenanceTest.PRE),
        recordWithPayload("{'artifact': {'name': 'after_post_grad_graph', 'encoding': 'string'}, 'compile_id': " + CID_A + "}",
            InductorProvenanceTest.POST),
        recordWithPayload("{'inductor_output_code': {'filename': '/tmp/abc.py'}, 'compile_id': " + CID_A + "}",
            InductorProvenanceTest.PY_CODE),
        recordWithPayload("{'artifact': {'name': 'inductor_provenance_tracking_node_mappings', 'encoding': 'json'},"
            + " 'compile_id': " + CID_A + "}", InductorProvenanceTest.MAPPINGS),
        record("{'dynamo_start': {'stack': []}, 'compile_id': " + CID_B + "}"),
    };
    Map<String, String> files = parse(cfg, lines).asMap();

    assertTrue(files.keySet().stream().anyMatch(p -> p.startsWith("-_0_0_0/inductor_output_code") && p.endsWith(".txt")));
    String page = files.get("provenance_tracking_-_0_0_0.html");
    assertNotNull(page);
    assertTrue(page.contains("<span id=\"py-L6\">    triton_poi_fused_mul_0.run(x, buf0)</span>"));
    assertTrue(page.contains("<span id=\"pre-L2\">    mul = x * 2</span>"));
    assertTrue(files.containsKey("provenance_tracking_-_1_0_0.html"));

    assertTrue(parse(lines).asMap().keySet().stream().noneMatch(p -> p.startsWith("provenance_tracking_")));
  }

  @Test
  void invalid_utf8_bytes_only_cost_their_own_line(@TempDir Path dir) throws Exception {
    Path log = dir.resolve("trace.log");
    byte[] good = (record("{'dynamo_start': {'stack': []}}") + "\n").getBytes(java.nio.charset.StandardCharsets.UTF_8);
    byte[] bad = {'g', 'a', 'r', (byte) 0xFF, 'b', '\n'};
    try (java.io.OutputStream os = Files.newOutputStream(log)) {
      os.write(good);
      os.write(bad);
      os.write(good);
    }

    ParseOutput out = new TraceLogParser(new ParseConfig()).parse(log);
    assertEquals(2, out.stats.ok);
    assertEquals(1, out.stats.failGlog);
    assertTrue(out.asMap().get("raw.log").contains("gar\uFFFDb"));
  }

  @Test
  void parsing_a_file_also_copies_the_raw_log(@TempDir Path dir) throws Exception {
    Path log = dir.resolve("trace.log");
    String text = recordWithPayload("{'aot_forward_graph': {}, 'compile_id': " + CID_A + "}", "g") + "\n";
    Files.writeString(log, text);

    ParseOutput out = new TraceLogParser(new ParseConfig()).parse(log);
    assertEquals(text, out.asMap().get("raw.log"));
    assertThrows(TraceLogException.class, () -> new TraceLogParser(new ParseConfig()).parse(dir));
  }

  private static List<String> fieldNames(JsonNode n) {
    List<String> out = new ArrayList<>();
    n.fieldNames().forEachRemaining(out::add);
    return out;
  }
}
