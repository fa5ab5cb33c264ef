package io.lacuna.lattice;

import java.util.Objects;

/**
 * The label carried by an {@link Edge}: either a symbol (a letter, a phoneme, an allophone string) or an integer
 * emission code.  Integer labels order before symbols.
 */
public final class Label implements Comparable<Label> {

  public static final Label SIL = new Label("_", 0);
  public static final Label EPS = new Label("*", 0);
  public static final Label BLANK = new Label("%", 0);

  private final String symbol;
  private final int code;

  private Label(String symbol, int code) {
    this.symbol = symbol;
    this.code = code;
  }

  public static Label of(String symbol) {
    if (symbol == null) {
      throw new IllegalArgumentException("label symbol must not be null");
    }
    switch (symbol) {
      case "_":
        return SIL;
      case "*":
        return EPS;
      case "%":
        return BLANK;
      default:
        return new Label(symbol, 0);
    }
  }

  public static Label of(int code) {
    return new Label(null, code);
  }

  public boolean isSymbol() {
    return symbol != null;
  }

  public boolean isInteger() {
    return symbol == null;
  }

  /**
   * @return true if this is one of the silence or epsilon placeholders
   */
  public boolean isSilenceOrEpsilon() {
    return equals(SIL) || equals(EPS);
  }

  public String symbol() {
    if (symbol == null) {
      throw new IllegalStateException("integer label " + code + " has no symbol");
    }
    return symbol;
  }

  public int code() {
    if (symbol != null) {
      throw new IllegalStateException("symbol label '" + symbol + "' has no code");
    }
    return code;
  }

  @Override
  public int compareTo(Label o) {
    if (isInteger() != o.isInteger()) {
      return isInteger() ? -1 : 1;
    }
    return isInteger() ? Integer.compare(code, o.code) : symbol.compareTo(o.symbol);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Label)) {
      return false;
    }
    Label l = (Label) o;
    return code == l.code && Objects.equals(symbol, l.symbol);
  }

  @Override
  public int hashCode() {
    return symbol == null ? Integer.hashCode(code) : symbol.hashCode();
  }

  @Override
  public String toString() {
    return symbol == null ? Integer.toString(code) : symbol;
  }
}
