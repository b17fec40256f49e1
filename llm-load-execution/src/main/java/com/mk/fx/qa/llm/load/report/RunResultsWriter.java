package com.mk.fx.qa.llm.load.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mk.fx.qa.llm.load.exceptions.RunSetupException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import lombok.extern.slf4j.Slf4j;

/** Writes {@link RunResultsDocument}s as pretty-printed JSON files into one directory. */
@Slf4j
public class RunResultsWriter {

  static final String FILE_PREFIX = "load_test_results_";
  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.systemDefault());
  private static final int RUN_ID_PREFIX_CHARS = 8;

  private final Path directory;
  private final ObjectMapper mapper;

  public RunResultsWriter(Path directory, ObjectMapper mapper) {
    this.directory = directory;
    this.mapper = mapper;
  }

  /**
   * Creates the results directory if needed and checks that it is writable.
   *
   * @throws RunSetupException when the directory cannot be used
   */
  public void prepare() {
    try {
      Files.createDirectories(directory);
    } catch (IOException | SecurityException e) {
      throw new RunSetupException("Cannot create results directory " + directory, e);
    }
    if (!Files.isDirectory(directory) || !Files.isWritable(directory)) {
      throw new RunSetupException("Results directory is not writable: " + directory, null);
    }
  }

  /**
   * Writes the document and returns the file path.
   *
   * @throws IOException when the file cannot be written
   */
  public Path write(RunResultsDocument document, Instant startedAt) throws IOException {
    var file = directory.resolve(fileName(document.runId(), startedAt));
    mapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(file.toFile(), document);
    log.info("Run {} results saved to {}", document.runId(), file.toAbsolutePath());
    return file;
  }

  static String fileName(String runId, Instant startedAt) {
    var prefix =
        runId.length() > RUN_ID_PREFIX_CHARS ? runId.substring(0, RUN_ID_PREFIX_CHARS) : runId;
    return FILE_PREFIX + FILE_TIMESTAMP.format(startedAt) + "_" + prefix + ".json";
  }
}
