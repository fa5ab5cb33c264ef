package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

/**
 * A {@link Lexicon} held in memory, in insertion order.
 */
public class MapLexicon implements Lexicon {

  private final LinearList<String> words = new LinearList<>();
  private final LinearMap<String, IList<Pronunciation>> pronunciations = new LinearMap<>();

  /**
   * @return this lexicon, with {@code phonemes} added as the next pronunciation variant of {@code word}
   */
  public MapLexicon add(String word, String phonemes, double score) {
    IList<Pronunciation> variants = pronunciations.get(word).orElse(null);
    if (variants == null) {
      variants = new LinearList<>();
      pronunciations.put(word, variants);
      words.addLast(word);
    }
    variants.addLast(new Pronunciation(phonemes, score));
    return this;
  }

  @Override
  public IList<String> words() {
    return words;
  }

  @Override
  public IList<Pronunciation> pronunciations(String word) {
    return pronunciations.get(word).orElseThrow(() -> new UnknownWordException(word));
  }

  @Override
  public boolean contains(String word) {
    return pronunciations.contains(word);
  }
}
