package org.lofarimaging.realtime.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.lofarimaging.realtime.application.port.SessionLogPort;
import org.lofarimaging.realtime.domain.status.ImageLogEntry;
import org.lofarimaging.realtime.infrastructure.json.JsonSupport;

/**
 * {@link SessionLogPort} storing the image log as a JSON array of
 * {@code {timestamp, filename, subband, status, duration, frame_index}} records.
 *
 * <p>Timestamps are written as ISO-8601 instants. On read, ISO strings (with or without offset, UTC assumed
 * when absent) and epoch milliseconds are both accepted; the latter is what older dashboards wrote.</p>
 *
 * @since 0.1.0
 */
public final class JsonSessionLogStore implements SessionLogPort {
  private final JsonSupport json = new JsonSupport();

  @Override
  public void save(Path file, List<ImageLogEntry> entries) throws IOException {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(entries, "entries");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator gen = json.factory().createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartArray();
      for (ImageLogEntry entry : entries) {
        gen.writeStartObject();
        gen.writeStringField("timestamp", entry.timestamp().toString());
        gen.writeStringField("filename", entry.filename());
        gen.writeNumberField("subband", entry.subband());
        gen.writeStringField("status", entry.status());
        if (entry.durationSeconds() == null) {
          gen.writeNullField("duration");
        } else {
          gen.writeNumberField("duration", entry.durationSeconds());
        }
        if (entry.frameIndex() == null) {
          gen.writeNullField("frame_index");
        } else {
          gen.writeNumberField("frame_index", entry.frameIndex());
        }
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    JsonSupport.writeAtomically(file, out.toByteArray());
  }

  @Override
  public List<ImageLogEntry> load(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    Object root = json.parse(Files.readString(file, StandardCharsets.UTF_8));
    if (!(root instanceof List<?> records)) {
      throw new IOException("Session log " + file + " is not a JSON array");
    }
    List<ImageLogEntry> entries = new ArrayList<>(records.size());
    for (Object record : records) {
      entries.add(toEntry(JsonSupport.asObject(record, "Session log record")));
    }
    return entries;
  }

  private static ImageLogEntry toEntry(Map<String, Object> record) throws IOException {
    Instant timestamp = parseTimestamp(record.get("timestamp"));
    Object filename = record.get("filename");
    if (filename == null) {
      throw new IOException("Session log record without filename");
    }
    Object status = record.get("status");
    Double duration = JsonSupport.optionalDouble(record, "duration");
    Double frameIndex = JsonSupport.optionalDouble(record, "frame_index");
    return new ImageLogEntry(
        timestamp,
        filename.toString(),
        (int) JsonSupport.requiredDouble(record, "subband"),
        status == null ? null : status.toString(),
        duration,
        frameIndex == null ? null : frameIndex.longValue());
  }

  static Instant parseTimestamp(Object value) throws IOException {
    if (value instanceof Number number) {
      return Instant.ofEpochMilli(number.longValue());
    }
    if (value instanceof String text && !text.isBlank()) {
      String normalized = text.strip().replace(' ', 'T');
      try {
        return OffsetDateTime.parse(normalized).toInstant();
      } catch (DateTimeParseException notOffset) {
        try {
          return LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException malformed) {
          throw new IOException("Unreadable timestamp '" + text + "'", malformed);
        }
      }
    }
    throw new IOException("Missing or unsupported timestamp: " + value);
  }
}
