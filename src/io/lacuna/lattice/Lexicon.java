package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

/**
 * Maps words onto their pronunciation variants.  Implementations are expected to be immutable once loaded, so that
 * they can be shared between builds.
 */
public interface Lexicon {

  /**
   * @return every word in the lexicon
   */
  IList<String> words();

  /**
   * @return the pronunciation variants of {@code word}, in lexicon order
   * @throws UnknownWordException if the word isn't in the lexicon
   */
  IList<Pronunciation> pronunciations(String word);

  default boolean contains(String word) {
    return words().stream().anyMatch(word::equals);
  }
}
