package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.*;

/**
 * Chrome trace of the estimated runtimes: one process per rank, one thread per graph, ops laid out
 * back to back from time zero.
 */
public class RuntimeTraceBuilder {

  public static ArrayNode build(List<GraphRuntime> runtimes) {
    ArrayNode events = Json.MAPPER.createArrayNode();
    SortedSet<Integer> pids = new TreeSet<>();
    Map<Integer, Map<Long, String>> threads = new TreeMap<>();

    for (GraphRuntime gr : runtimes) {
      pids.add(gr.rank);
      long tid = tid(gr.rank, gr.graph);
      threads.computeIfAbsent(gr.rank, k -> new LinkedHashMap<>()).putIfAbsent(tid, gr.graph);

      long ts = 0;
      for (OpRuntime op : gr.ops) {
        long dur = durationUs(op.estimatedRuntimeNs);
        ObjectNode ev = events.addObject();
        ev.put("name", op.name);
        ev.put("ph", "X");
        ev.put("ts", ts);
        ev.put("dur", dur);
        ev.put("pid", gr.rank);
        ev.put("tid", tid);
        ev.put("cat", "runtime");
        ObjectNode args = ev.putObject("args");
        args.put("graph", gr.graph);
        args.put("rank", gr.rank);
        args.put("runtime_ns", (long) op.estimatedRuntimeNs);
        ts += dur;
      }
    }

    for (int pid : pids) {
      ObjectNode name = events.addObject();
      name.put("name", "process_name");
      name.put("ph", "M");
      name.put("pid", pid);
      name.putObject("args").put("name", "Rank " + pid);
      ObjectNode sort = events.addObject();
      sort.put("name", "process_sort_index");
      sort.put("ph", "M");
      sort.put("pid", pid);
      sort.putObject("args").put("sort_index", pid);
    }

    for (var e : threads.entrySet()) {
      int pid = e.getKey();
      List<Map.Entry<Long, String>> ts = new ArrayList<>(e.getValue().entrySet());
      ts.sort(Map.Entry.comparingByValue());
      int idx = 0;
      for (Map.Entry<Long, String> t : ts) {
        ObjectNode name = events.addObject();
        name.put("name", "thread_name");
        name.put("ph", "M");
        name.put("pid", pid);
        name.put("tid", t.getKey());
        name.putObject("args").put("name", "graph " + t.getValue());
        ObjectNode sort = events.addObject();
        sort.put("name", "thread_sort_index");
        sort.put("ph", "M");
        sort.put("pid", pid);
        sort.put("tid", t.getKey());
        sort.putObject("args").put("sort_index", idx++);
      }
    }
    return events;
  }

  /** Deterministic 32-bit thread id for a (rank, graph) pair. */
  static long tid(int rank, String graph) {
    return Objects.hash(rank, graph) & 0xFFFFFFFFL;
  }

  /** Whole microseconds, rounded up, never below one. */
  static long durationUs(double ns) {
    return (long) Math.max(1.0, Math.ceil(ns / 1000.0));
  }
}
