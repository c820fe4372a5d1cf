package org.lofarimaging.realtime.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.lofarimaging.realtime.application.port.StatusSink;
import org.lofarimaging.realtime.domain.status.StatusSnapshot;
import org.lofarimaging.realtime.domain.status.TrackingSample;
import org.lofarimaging.realtime.infrastructure.json.JsonSupport;

/**
 * {@link StatusSink} writing the snapshot as a JSON object, replaced atomically on each publish. Field names
 * follow the dashboard's status contract ({@code last_block}, {@code pending_threads}, ...); {@code last_block}
 * counts blocks read, so it is 3 after the third block.
 *
 * @since 0.1.0
 */
public final class JsonStatusFileSink implements StatusSink {
  private final JsonSupport json = new JsonSupport();

  @Override
  public void publish(StatusSnapshot snapshot, Path target) throws IOException {
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(target, "target");
    JsonSupport.writeAtomically(target, render(snapshot));
  }

  byte[] render(StatusSnapshot snapshot) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator gen = json.factory().createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("status", snapshot.status().label());
      writeNullableLong(gen, "last_block", snapshot.lastBlockNumber());
      writeNullableLong(gen, "last_subband", snapshot.lastSubband() == null ? null : snapshot.lastSubband().longValue());
      gen.writeNumberField("pending_threads", snapshot.pendingCount());
      gen.writeNumberField("avg_processing_time", snapshot.avgProcessingSeconds());
      if (snapshot.currentFile() == null) {
        gen.writeNullField("current_dat_file");
      } else {
        gen.writeStringField("current_dat_file", snapshot.currentFile());
      }
      if (snapshot.subbandRange() == null) {
        gen.writeNullField("subband_range");
      } else {
        gen.writeArrayFieldStart("subband_range");
        gen.writeNumber(snapshot.subbandRange().min());
        gen.writeNumber(snapshot.subbandRange().max());
        gen.writeEndArray();
      }
      gen.writeNumberField("threads", snapshot.threads());
      gen.writeNumberField("step", snapshot.step());
      gen.writeNumberField("height_m", snapshot.heightMetres());
      gen.writeNumberField("extent", snapshot.extentMetres());
      TrackingSample tracking = snapshot.lastTracking();
      if (tracking == null) {
        gen.writeNullField("tracking");
      } else {
        gen.writeObjectFieldStart("tracking");
        gen.writeStringField("timestamp", tracking.timestamp());
        gen.writeNumberField("lat", tracking.lat());
        gen.writeNumberField("lon", tracking.lon());
        gen.writeNumberField("x_m", tracking.xMetres());
        gen.writeNumberField("y_m", tracking.yMetres());
        gen.writeNumberField("power_db", tracking.powerDb());
        writeNullableLong(gen, "subband", tracking.subband() == null ? null : tracking.subband().longValue());
        gen.writeEndObject();
      }
      if (snapshot.velocityMps() == null) {
        gen.writeNullField("velocity_mps");
      } else {
        gen.writeNumberField("velocity_mps", snapshot.velocityMps());
      }
      gen.writeEndObject();
    }
    return out.toByteArray();
  }

  private static void writeNullableLong(JsonGenerator gen, String field, Long value) throws IOException {
    if (value == null) {
      gen.writeNullField(field);
    } else {
      gen.writeNumberField(field, value.longValue());
    }
  }
}
