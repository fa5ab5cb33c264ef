package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Memoizes loaded lexicons by path.  The loader does the actual parsing; the cache itself never touches the
 * filesystem.
 */
public class LexiconCache {

  private final LinearMap<Path, Lexicon> cache = new LinearMap<>();
  private final Function<Path, Lexicon> loader;

  public LexiconCache(Function<Path, Lexicon> loader) {
    if (loader == null) {
      throw new IllegalArgumentException("loader must not be null");
    }
    this.loader = loader;
  }

  /**
   * @return the lexicon for {@code path}, loading it on first use
   */
  public synchronized Lexicon get(Path path) {
    Path key = path.toAbsolutePath().normalize();
    Lexicon lexicon = cache.get(key).orElse(null);
    if (lexicon == null) {
      lexicon = loader.apply(key);
      if (lexicon == null) {
        throw new IllegalStateException("loader returned no lexicon for " + key);
      }
      cache.put(key, lexicon);
    }
    return lexicon;
  }

  public synchronized boolean contains(Path path) {
    return cache.contains(path.toAbsolutePath().normalize());
  }

  public synchronized void invalidate(Path path) {
    cache.remove(path.toAbsolutePath().normalize());
  }
}
