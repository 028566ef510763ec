package com.skytrail.segmenter.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Lists and batches the input files of a run. */
public final class InputFiles {

  private InputFiles() {}

  /**
   * Lists regular files matching a glob, sorted by file name.
   *
   * @param dir input directory
   * @param glob file name glob such as {@code *.jsonl}
   * @return matching files in stable name order
   */
  public static List<Path> list(Path dir, String glob) {
    if (!Files.isDirectory(dir)) {
      throw new IllegalStateException("Input dir does not exist: " + dir);
    }
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
      for (Path path : stream) {
        if (Files.isRegularFile(path)) {
          files.add(path);
        }
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to list " + dir, ex);
    }
    files.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
    return files;
  }

  /**
   * Splits files into consecutive chunks of at most {@code chunkSize} files.
   *
   * @param files ordered files
   * @param chunkSize files per chunk, &gt; 0
   * @return chunks in file order
   */
  public static List<List<Path>> chunk(List<Path> files, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0");
    }
    List<List<Path>> chunks = new ArrayList<>();
    for (int i = 0; i < files.size(); i += chunkSize) {
      chunks.add(List.copyOf(files.subList(i, Math.min(files.size(), i + chunkSize))));
    }
    return chunks;
  }
}
