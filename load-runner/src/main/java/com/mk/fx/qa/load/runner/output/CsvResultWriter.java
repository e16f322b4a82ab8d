package com.mk.fx.qa.load.runner.output;

import static com.mk.fx.qa.load.runner.utils.LoadUtils.toEpochNanos;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.mk.fx.qa.load.runner.model.Result;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes one CSV record per result: send timestamp (epoch nanoseconds), status code, latency
 * (nanoseconds), error text and sequence number. Every record is flushed as soon as it is written.
 */
public class CsvResultWriter implements Closeable {

  public static final String STDOUT = "stdout";

  private static final CsvMapper MAPPER =
      CsvMapper.builder().enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING).build();

  private final SequenceWriter records;

  public CsvResultWriter(Writer target, boolean closeTarget) throws IOException {
    var writer = MAPPER.writer(CsvSchema.emptySchema().withoutHeader());
    if (!closeTarget) {
      writer = writer.without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }
    this.records = writer.writeValues(target);
  }

  /**
   * Opens the writer for {@code outputFile}: {@value #STDOUT} writes to {@code stdout}, which is
   * left open on close; anything else is a file path that is created or truncated.
   *
   * @throws IOException if the file cannot be opened
   */
  public static CsvResultWriter open(String outputFile, OutputStream stdout) throws IOException {
    if (outputFile == null || outputFile.isBlank() || STDOUT.equals(outputFile)) {
      return new CsvResultWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8), false);
    }
    try {
      return new CsvResultWriter(Files.newBufferedWriter(Path.of(outputFile)), true);
    } catch (IOException ex) {
      throw new IOException("error opening " + outputFile + ": " + ex.getMessage(), ex);
    }
  }

  public void write(Result result) throws IOException {
    records.write(
        new String[] {
          Long.toString(toEpochNanos(result.timestamp())),
          Integer.toString(result.code()),
          Long.toString(result.latency().toNanos()),
          result.error(),
          Long.toString(result.seq())
        });
    records.flush();
  }

  @Override
  public void close() throws IOException {
    records.close();
  }
}
