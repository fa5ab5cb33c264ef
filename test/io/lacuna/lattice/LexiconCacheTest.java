package io.lacuna.lattice;

import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class LexiconCacheTest {

  @Test
  public void testLoadsOnce() {
    AtomicInteger loads = new AtomicInteger();
    LexiconCache cache = new LexiconCache(path -> {
      loads.incrementAndGet();
      return new MapLexicon().add(path.getFileName().toString(), "x", 0.0);
    });

    Path path = Paths.get("lexicon.xml");
    Lexicon first = cache.get(path);
    Lexicon second = cache.get(Paths.get("./lexicon.xml"));

    assertSame(first, second);
    assertEquals(1, loads.get());
    assertTrue(cache.contains(path));
    assertTrue(first.contains("lexicon.xml"));

    cache.invalidate(path);
    assertFalse(cache.contains(path));
    assertNotSame(first, cache.get(path));
    assertEquals(2, loads.get());
  }

  @Test
  public void testLoaderFailure() {
    LexiconCache cache = new LexiconCache(path -> null);
    assertThrows(IllegalStateException.class, () -> cache.get(Paths.get("missing")));
    assertFalse(cache.contains(Paths.get("missing")));
    assertThrows(IllegalArgumentException.class, () -> new LexiconCache(null));
  }
}
