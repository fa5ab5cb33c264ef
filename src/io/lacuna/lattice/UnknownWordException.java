package io.lacuna.lattice;

/**
 * Thrown when a word has no entry in the {@link Lexicon}.
 */
public class UnknownWordException extends RuntimeException {

  private final String word;

  public UnknownWordException(String word) {
    super("word not in lexicon: '" + word + "'");
    this.word = word;
  }

  public String word() {
    return word;
  }
}
