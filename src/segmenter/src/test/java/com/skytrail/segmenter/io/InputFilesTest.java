package com.skytrail.segmenter.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InputFilesTest {
  @TempDir
  Path dir;

  @Test
  void listsMatchingFilesInNameOrder() throws Exception {
    Files.writeString(dir.resolve("positions_03.jsonl"), "");
    Files.writeString(dir.resolve("positions_01.jsonl"), "");
    Files.writeString(dir.resolve("positions_02.jsonl"), "");
    Files.writeString(dir.resolve("readme.txt"), "");
    Files.createDirectory(dir.resolve("nested.jsonl"));

    List<Path> files = InputFiles.list(dir, "*.jsonl");

    assertThat(files).extracting(p -> p.getFileName().toString())
        .containsExactly("positions_01.jsonl", "positions_02.jsonl", "positions_03.jsonl");
  }

  @Test
  void missingDirectoryFails() {
    assertThatThrownBy(() -> InputFiles.list(dir.resolve("missing"), "*.jsonl"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void chunksKeepOrderAndCarryRemainder() {
    List<Path> files = List.of(Path.of("a"), Path.of("b"), Path.of("c"), Path.of("d"), Path.of("e"));

    List<List<Path>> chunks = InputFiles.chunk(files, 2);

    assertThat(chunks).containsExactly(
        List.of(Path.of("a"), Path.of("b")),
        List.of(Path.of("c"), Path.of("d")),
        List.of(Path.of("e")));
    assertThat(InputFiles.chunk(List.of(), 5)).isEmpty();
    assertThatThrownBy(() -> InputFiles.chunk(files, 0)).isInstanceOf(IllegalArgumentException.class);
  }
}
