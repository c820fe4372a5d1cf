package org.lofarimaging.realtime.domain.block;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SubbandCyclerTest {

  @Test
  void cyclesThroughRangeInclusive() {
    int[] expected = {100, 101, 102, 100, 101, 102, 100};
    for (int i = 0; i < expected.length; i++) {
      assertEquals(expected[i], SubbandCycler.subband(i, 100, 102), "index " + i);
    }
  }

  @Test
  void singleSubbandRangeAlwaysReturnsMin() {
    SubbandRange range = new SubbandRange(256, 256);
    for (long i = 0; i < 5; i++) {
      assertEquals(256, SubbandCycler.subband(i, range));
    }
  }

  @Test
  void largeIndexStaysInsideRange() {
    SubbandRange range = new SubbandRange(10, 19);
    assertEquals(10 + (int) (9_999_999_999L % 10), SubbandCycler.subband(9_999_999_999L, range));
  }

  @Test
  void rejectsNegativeIndex() {
    assertThrows(IllegalArgumentException.class, () -> SubbandCycler.subband(-1, 0, 3));
  }

  @Test
  void rejectsInvertedRange() {
    assertThrows(IllegalArgumentException.class, () -> SubbandCycler.subband(0, 5, 4));
  }
}
