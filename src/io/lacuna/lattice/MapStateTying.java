package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

import java.util.Optional;

/**
 * A {@link StateTying} held in memory.
 */
public class MapStateTying implements StateTying {

  private final LinearMap<String, Integer> ids = new LinearMap<>();

  public MapStateTying put(String allophone, int id) {
    if (id < 0) {
      throw new IllegalArgumentException("negative id for '" + allophone + "': " + id);
    }
    ids.put(allophone, id);
    return this;
  }

  @Override
  public Optional<Integer> id(String allophone) {
    return ids.get(allophone);
  }

  public long size() {
    return ids.size();
  }
}
