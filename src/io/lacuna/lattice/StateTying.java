package io.lacuna.lattice;

import java.util.Optional;

/**
 * Maps allophone strings, such as {@code "a{#+b}@i.0"}, onto the ids of the models they are tied to.
 */
public interface StateTying {

  Optional<Integer> id(String allophone);
}
