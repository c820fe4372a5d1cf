package org.lofarimaging.realtime.infrastructure.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.lofarimaging.realtime.application.port.RenderResult;
import org.lofarimaging.realtime.domain.status.TrackingSample;

class RenderOutputParserTest {
  private final RenderOutputParser parser = new RenderOutputParser();
  private final Path outputDir = Path.of("/data/images/20240301_101500/images");

  @Test
  void parsesImagesAndTracking() throws Exception {
    RenderResult result = parser.parse(List.of(
        "calibrating...",
        "sky=sky_101.png",
        "  nearfield=/abs/nearfield_101.png  ",
        "tracking={\"timestamp\": \"2024-03-01 10:15:00\", \"lat\": 56.9, \"lon\": 21.8,"
            + " \"x_m\": 1.5, \"y_m\": -2.0, \"power_db\": -40.1, \"subband\": 101}"), outputDir);

    assertEquals(outputDir.resolve("sky_101.png"), result.skyImage().orElseThrow());
    assertEquals(Path.of("/abs/nearfield_101.png"), result.nearFieldImage().orElseThrow());
    TrackingSample tracking = result.tracking().orElseThrow();
    assertEquals("2024-03-01 10:15:00", tracking.timestamp());
    assertEquals(-2.0, tracking.yMetres());
    assertEquals(101, tracking.subband());
  }

  @Test
  void silentRendererProducesEmptyResult() throws Exception {
    RenderResult result = parser.parse(List.of("done", "nearfield="), outputDir);
    assertTrue(result.skyImage().isEmpty());
    assertTrue(result.nearFieldImage().isEmpty());
    assertTrue(result.tracking().isEmpty());
  }

  @Test
  void trackingWithoutSubbandLeavesItUnset() throws Exception {
    TrackingSample sample =
        parser.parseTracking("{\"lat\": 1, \"lon\": 2, \"x_m\": 3, \"y_m\": 4, \"power_db\": 5}");
    assertNull(sample.subband());
    assertNull(sample.timestamp());
  }

  @Test
  void malformedTrackingFails() {
    assertThrows(IOException.class, () -> parser.parseTracking("{\"lat\": 1}"));
    assertThrows(IOException.class, () -> parser.parseTracking("[1, 2]"));
  }
}
