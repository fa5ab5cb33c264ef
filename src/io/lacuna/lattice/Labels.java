package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

/**
 * Maps symbolic labels onto integer codes.
 */
public class Labels {

  private Labels() {
  }

  /**
   * Rewrites the label of every edge in place: {@link Label#BLANK} becomes the code of the space character,
   * {@link Label#SIL}, {@link Label#EPS} and integer labels are kept, and single-character symbols become their
   * code point.
   *
   * @throws LabelConversionException if a label is none of the above
   */
  public static void convert(IList<Edge> edges) {
    for (Edge e : edges) {
      e.label = convert(e.label);
    }
  }

  public static Label convert(Label label) {
    if (label.equals(Label.BLANK)) {
      return Label.of(' ');
    } else if (label.isInteger() || label.isSilenceOrEpsilon()) {
      return label;
    }

    String s = label.symbol();
    if (s.codePointCount(0, s.length()) != 1) {
      throw new LabelConversionException("can't convert label '" + s + "' to an integer");
    }
    return Label.of(s.codePointAt(0));
  }
}
