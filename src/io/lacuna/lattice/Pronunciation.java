package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

import java.util.Objects;

/**
 * One way of pronouncing a word: a space-separated phoneme string and its score.
 */
public final class Pronunciation {

  private final String phonemes;
  private final double score;

  public Pronunciation(String phonemes, double score) {
    this.phonemes = Objects.requireNonNull(phonemes);
    this.score = score;
  }

  public String phonemes() {
    return phonemes;
  }

  /**
   * @return the phonemes, split on single spaces
   */
  public IList<String> phonemeList() {
    return LinearList.of(phonemes.split(" ", -1));
  }

  public double score() {
    return score;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Pronunciation)) {
      return false;
    }
    Pronunciation p = (Pronunciation) o;
    return Double.compare(score, p.score) == 0 && phonemes.equals(p.phonemes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(phonemes, score);
  }

  @Override
  public String toString() {
    return phonemes + " (" + score + ")";
  }
}
