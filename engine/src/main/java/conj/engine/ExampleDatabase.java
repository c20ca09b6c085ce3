package conj.engine;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Storage for tapes worth replaying in later runs, as a multimap from key to values. Implementations must tolerate
 * concurrent use and treat saving an existing value or deleting a missing one as a no-op.
 */
public interface ExampleDatabase extends AutoCloseable {
  /** Add the value under the key */
  void save(byte[] key, byte[] value);

  /** All values under the key, in no particular order */
  List<byte[]> fetch(byte[] key);

  /** Remove the value from the key */
  void delete(byte[] key, byte[] value);

  /** Move the value from one key to another */
  default void move(byte[] src, byte[] dest, byte[] value) {
    if (Arrays.equals(src, dest)) {
      save(src, value);
      return;
    }
    delete(src, value);
    save(dest, value);
  }

  @Override
  default void close() { }

  /** An {@link ExampleDatabase} held in a thread-safe map, lost when the process ends */
  class InMemory implements ExampleDatabase {
    /** The map being used */
    public final Map<ByteBuffer, Set<ByteBuffer>> backingMap;

    /** Create a database backed by a {@link ConcurrentHashMap} */
    public InMemory() { this(new ConcurrentHashMap<>()); }

    /** Create a database backed by the given map, which must already be thread safe */
    public InMemory(Map<ByteBuffer, Set<ByteBuffer>> backingMap) {
      this.backingMap = backingMap;
    }

    @Override
    public void save(byte[] key, byte[] value) {
      backingMap.computeIfAbsent(wrap(key), k -> Collections.newSetFromMap(new ConcurrentHashMap<>()))
          .add(wrap(value));
    }

    @Override
    public List<byte[]> fetch(byte[] key) {
      Set<ByteBuffer> values = backingMap.get(wrap(key));
      List<byte[]> result = new ArrayList<>();
      if (values != null) for (ByteBuffer value : values) result.add(value.array().clone());
      return result;
    }

    @Override
    public void delete(byte[] key, byte[] value) {
      Set<ByteBuffer> values = backingMap.get(wrap(key));
      if (values != null) values.remove(wrap(value));
    }

    private static ByteBuffer wrap(byte[] bytes) { return ByteBuffer.wrap(bytes.clone()); }
  }
}
