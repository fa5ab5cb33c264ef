package io.lacuna.lattice.batch;

/**
 * How a single label is emitted in a {@link SimpleFsa} chain.  The variants are fixed: {@link Default},
 * {@link Loop} and {@link Twice}.
 */
public abstract class StateModel {

  /**
   * Receives the edges a state model emits.
   */
  interface Sink {
    void edge(int from, int to, int label, int lengthModel, float weight);
  }

  public static final StateModel DEFAULT = new Default(0, 0.0f);

  private StateModel() {
  }

  /**
   * Emits the edges for {@code label} starting at {@code state}.
   *
   * @return the state the next label starts at
   */
  abstract int emit(int label, int state, Sink sink);

  /**
   * Moves on to the next state.
   */
  public static final class Default extends StateModel {
    private final int lengthModel;
    private final float weight;

    public Default(int lengthModel, float weight) {
      this.lengthModel = lengthModel;
      this.weight = weight;
    }

    @Override
    int emit(int label, int state, Sink sink) {
      sink.edge(state, state + 1, label, lengthModel, weight);
      return state + 1;
    }
  }

  /**
   * May stay in the current state before moving on.
   */
  public static final class Loop extends StateModel {
    private final int lengthModel;
    private final float forwardScore;
    private final float loopScore;

    public Loop(int lengthModel, float forwardScore, float loopScore) {
      this.lengthModel = lengthModel;
      this.forwardScore = forwardScore;
      this.loopScore = loopScore;
    }

    @Override
    int emit(int label, int state, Sink sink) {
      sink.edge(state, state, label, lengthModel, loopScore);
      sink.edge(state, state + 1, label, lengthModel, forwardScore);
      return state + 1;
    }
  }

  /**
   * Emits the label either once or twice; the two halves of the twice path share its score.
   */
  public static final class Twice extends StateModel {
    private final int onceLengthModel;
    private final int firstLengthModel;
    private final int secondLengthModel;
    private final float onceScore;
    private final float twiceScore;

    public Twice(int onceLengthModel, int firstLengthModel, int secondLengthModel, float onceScore, float twiceScore) {
      this.onceLengthModel = onceLengthModel;
      this.firstLengthModel = firstLengthModel;
      this.secondLengthModel = secondLengthModel;
      this.onceScore = onceScore;
      this.twiceScore = twiceScore;
    }

    @Override
    int emit(int label, int state, Sink sink) {
      sink.edge(state, state + 2, label, onceLengthModel, onceScore);
      sink.edge(state, state + 1, label, firstLengthModel, 0.5f * twiceScore);
      sink.edge(state + 1, state + 2, label, secondLengthModel, 0.5f * twiceScore);
      return state + 2;
    }
  }
}
