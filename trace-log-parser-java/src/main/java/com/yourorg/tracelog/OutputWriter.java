package com.yourorg.tracelog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Comparator;
import java.util.stream.Stream;

/** The only place that writes to disk. */
public final class OutputWriter {

  private OutputWriter() {}

  /** Creates {@code dir}, replacing an existing one only when {@code overwrite} is set. */
  public static void setupOutputDirectory(Path dir, boolean overwrite) throws IOException, TraceLogException {
    if (Files.exists(dir)) {
      if (!overwrite) {
        throw new TraceLogException("Directory " + dir + " already exists; pass --overwrite to replace it");
      }
      deleteRecursively(dir);
    }
    Files.createDirectories(dir);
  }

  /** Writes every entry of {@code out} below {@code dir}, creating parent directories. */
  public static void write(ParseOutput out, Path dir) throws IOException, TraceLogException {
    for (ParseOutput.Entry e : out.files) {
      writeString(dir, e.path, e.content);
    }
  }

  public static Path writeString(Path dir, String relative, String content) throws IOException, TraceLogException {
    Path base = dir.toAbsolutePath().normalize();
    Path target = base.resolve(relative).normalize();
    if (!target.startsWith(base) || target.equals(base)) {
      throw new TraceLogException("Refusing to write " + relative + " outside of " + dir);
    }
    Files.createDirectories(target.getParent());
    Files.writeString(target, content, StandardCharsets.UTF_8);
    return target;
  }

  static void deleteRecursively(Path dir) throws IOException {
    try (Stream<Path> walk = Files.walk(dir)) {
      for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
        Files.delete(p);
      }
    }
  }
}
