package com.yourorg.tracelog;

import ch.qos.logback.classic.Level;
import java.nio.file.Path;
import java.util.*;
import org.slf4j.LoggerFactory;

public class Main {

  private static final String USAGE = """
      Usage:
        java -jar trace-log-parser-java.jar parse <logFile> <outDir> [flags]
        java -jar trace-log-parser-java.jar all-ranks <logDir> <outDir> [flags]
      Flags:
        --strict             fail if any record could not be parsed
        --strict-compile-id  fail if any record has no compile id
        --verbose            log every unknown field and debug detail
        --plain-text         write generated code as .txt instead of .html
        --export             only report export failures
        --inductor-provenance  write provenance tracking pages per compile
        --overwrite          replace an existing output directory
      """;

  public static void main(String[] args) {
    if (args.length < 3) {
      System.err.print(USAGE);
      System.exit(1);
    }

    ParseConfig cfg = new ParseConfig();
    boolean overwrite = false;
    for (String flag : Arrays.asList(args).subList(3, args.length)) {
      switch (flag) {
        case "--strict" -> cfg.strict = true;
        case "--strict-compile-id" -> cfg.strictCompileId = true;
        case "--verbose" -> cfg.verbose = true;
        case "--plain-text" -> cfg.plainText = true;
        case "--export" -> cfg.export = true;
        case "--inductor-provenance" -> cfg.inductorProvenance = true;
        case "--overwrite" -> overwrite = true;
        default -> {
          System.err.println("Unknown flag: " + flag);
          System.err.print(USAGE);
          System.exit(1);
        }
      }
    }
    if (cfg.verbose) {
      ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.yourorg.tracelog")).setLevel(Level.DEBUG);
    }

    Path in = Path.of(args[1]);
    Path outDir = Path.of(args[2]);
    try {
      if ("parse".equals(args[0])) {
        OutputWriter.setupOutputDirectory(outDir, overwrite);
        ParseOutput out = new TraceLogParser(cfg).parse(in);
        OutputWriter.write(out, outDir);
        System.out.println("Wrote: " + outDir.toAbsolutePath());
        System.out.println(out.stats);
      } else if ("all-ranks".equals(args[0])) {
        MultiRankReport report = new MultiRankAnalyzer(cfg).run(in, outDir, overwrite);
        System.out.println("Ranks=" + report.ranks.size());
        System.out.println("Divergence=" + report.showDesyncWarning);
      } else {
        System.err.print(USAGE);
        System.exit(1);
      }
    } catch (Exception e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    }
  }
}
