package org.lofarimaging.realtime.domain.block;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text format of the {@code _xst.h} sidecar written next to each archived block.
 *
 * <p>The content is exactly {@code --subbands=<min>:<max>\n- rspctl --xcsubband=<subband>\n}; downstream
 * LOFAR tooling reads it byte for byte.</p>
 *
 * @since 0.1.0
 */
public final class BlockSidecar {
  private static final Pattern XC_SUBBAND = Pattern.compile("--xcsubband=(\\d+)");

  private BlockSidecar() {
    // Utility
  }

  /**
   * Renders the sidecar text.
   *
   * @param range subband range of the observation
   * @param subband subband of the archived block
   * @return sidecar content
   */
  public static String render(SubbandRange range, int subband) {
    Objects.requireNonNull(range, "range");
    return "--subbands=" + range.min() + ":" + range.max() + "\n"
        + "- rspctl --xcsubband=" + subband + "\n";
  }

  /**
   * Extracts the block subband from sidecar text.
   *
   * @param content sidecar content
   * @return subband, or empty when no {@code --xcsubband=} token is present
   */
  public static OptionalInt parseSubband(String content) {
    if (content == null) {
      return OptionalInt.empty();
    }
    Matcher matcher = XC_SUBBAND.matcher(content);
    if (!matcher.find()) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(Integer.parseInt(matcher.group(1)));
  }
}
