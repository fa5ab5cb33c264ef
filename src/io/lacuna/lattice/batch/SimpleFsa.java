package io.lacuna.lattice.batch;

import io.lacuna.bifurcan.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Map;

/**
 * Builds one linear chain per sequence of a label batch, each label emitted according to its {@link StateModel}.
 * Sequences are separated by an unused state.
 */
public class SimpleFsa {

  private final BatchFsa fsa;
  private final int[] lengthModels;

  private SimpleFsa(BatchFsa fsa, int[] lengthModels) {
    this.fsa = fsa;
    this.lengthModels = lengthModels;
  }

  private static final class Row {
    final int from, to, label, lengthModel, seq;
    final float weight;

    Row(int from, int to, int label, int lengthModel, int seq, float weight) {
      this.from = from;
      this.to = to;
      this.label = label;
      this.lengthModel = lengthModel;
      this.seq = seq;
      this.weight = weight;
    }
  }

  /**
   * @param labels {@code [time][batch]} label ids, negative entries being padding
   * @param stateModels state models by label, {@link StateModel#DEFAULT} for labels without one
   */
  public static SimpleFsa build(int[][] labels, Map<Integer, StateModel> stateModels) {
    int numBatch = labels.length == 0 ? 0 : labels[0].length;
    LinearList<Row> rows = new LinearList<>();
    int[][] startEndStates = new int[2][numBatch];

    int state = 0;
    for (int b = 0; b < numBatch; b++) {
      final int seq = b;
      int start = state;
      for (int[] step : labels) {
        if (step.length != numBatch) {
          throw new IllegalArgumentException("ragged label batch");
        }
        int label = step[b];
        if (label < 0) {
          continue;
        }
        StateModel model = stateModels.getOrDefault(label, StateModel.DEFAULT);
        state = model.emit(label, state,
                (from, to, l, lengthModel, weight) -> rows.addLast(new Row(from, to, l, lengthModel, seq, weight)));
      }
      startEndStates[0][b] = start;
      startEndStates[1][b] = state;
      state++;
    }

    // stable, so edges of equal span keep their order
    ArrayList<Row> sorted = new ArrayList<>((int) rows.size());
    rows.forEach(sorted::add);
    sorted.sort(Comparator.comparingInt(r -> r.to - r.from));

    int n = sorted.size();
    int[][] edges = new int[4][n];
    float[] weights = new float[n];
    int[] lengthModels = new int[n];
    for (int i = 0; i < n; i++) {
      Row r = sorted.get(i);
      edges[BatchFsa.FROM][i] = r.from;
      edges[BatchFsa.TO][i] = r.to;
      edges[BatchFsa.EMISSION][i] = r.label;
      edges[BatchFsa.SEQUENCE][i] = r.seq;
      weights[i] = r.weight;
      lengthModels[i] = r.lengthModel;
    }

    return new SimpleFsa(new BatchFsa(edges, weights, startEndStates), lengthModels);
  }

  public BatchFsa fsa() {
    return fsa;
  }

  /**
   * @return the length model id of each edge of {@link #fsa()}
   */
  public int[] lengthModels() {
    return lengthModels;
  }
}
