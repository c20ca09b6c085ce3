package conj.extras;

import conj.engine.ExampleDatabase;
import conj.engine.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.*;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * An {@link ExampleDatabase} kept as a tree of files. Each key is a directory named by a hash of the key, and each
 * value is a file in it named by a hash of the value. Files are written to a temporary name and renamed into place so
 * concurrent readers never see a partial value.
 */
public class DirectoryDatabase implements ExampleDatabase {
  private static final Logger log = LoggerFactory.getLogger(DirectoryDatabase.class);

  /** Helper to read a file into a byte buffer. The buffer is flipped before returned. */
  public static ByteBuffer readFile(Path path, OpenOption... options) {
    try (SeekableByteChannel file = Files.newByteChannel(path, options)) {
      ByteBuffer buf = ByteBuffer.allocate((int) file.size());
      while (buf.hasRemaining()) {
        if (file.read(buf) < 0) throw new IOException("Failed reading entire file");
      }
      buf.flip();
      return buf;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** First 16 hex chars of the SHA-1 of the bytes */
  public static String hash(byte[] bytes) {
    try {
      return Util.hex(MessageDigest.getInstance("SHA-1").digest(bytes)).substring(0, 16);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }

  /** The config set in the constructor */
  public final Config config;
  protected final Map<ByteBuffer, Path> keyPaths = new ConcurrentHashMap<>();
  protected final Random tempNames = new Random();

  public DirectoryDatabase(Config config) { this.config = config; }

  /** Shortcut for a database at the root with fail on error set */
  public DirectoryDatabase(Path root) { this(new Config(root)); }

  /** The directory for the key, created if not present */
  protected Path keyPath(byte[] key) {
    return keyPaths.computeIfAbsent(ByteBuffer.wrap(key.clone()), k -> {
      Path dir = config.root.resolve(hash(key));
      try {
        Files.createDirectories(dir);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      return dir;
    });
  }

  protected Path valuePath(byte[] key, byte[] value) { return keyPath(key).resolve(hash(value)); }

  @Override
  public void save(byte[] key, byte[] value) {
    try {
      Path path = valuePath(key, value);
      if (Files.exists(path)) return;
      Path temp = path.resolveSibling(path.getFileName() + "." + Long.toHexString(tempNames.nextLong()));
      try {
        Files.write(temp, value, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE);
      } catch (IOException e) {
        Files.deleteIfExists(temp);
        throw e;
      }
    } catch (IOException e) {
      fail("save", new UncheckedIOException(e));
    } catch (UncheckedIOException e) {
      fail("save", e);
    }
  }

  @Override
  public List<byte[]> fetch(byte[] key) {
    List<byte[]> result = new ArrayList<>();
    Path dir = keyPath(key);
    try (Stream<Path> files = Files.list(dir)) {
      // Temporary files carry a suffix after a dot
      files.filter(file -> file.getFileName().toString().indexOf('.') < 0).forEach(file -> {
        try {
          ByteBuffer buf = readFile(file, StandardOpenOption.READ);
          byte[] value = new byte[buf.remaining()];
          buf.get(value);
          result.add(value);
        } catch (UncheckedIOException e) {
          // Deleted concurrently
          if (!(e.getCause() instanceof NoSuchFileException)) throw e;
          log.debug("Value file {} disappeared during fetch", file);
        }
      });
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result;
  }

  @Override
  public void delete(byte[] key, byte[] value) {
    try {
      Files.deleteIfExists(valuePath(key, value));
    } catch (IOException e) {
      fail("delete", new UncheckedIOException(e));
    } catch (UncheckedIOException e) {
      fail("delete", e);
    }
  }

  @Override
  public void move(byte[] src, byte[] dest, byte[] value) {
    if (Arrays.equals(src, dest)) {
      save(src, value);
      return;
    }
    try {
      Files.move(valuePath(src, value), valuePath(dest, value), StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException | UncheckedIOException e) {
      // Source may be gone or destination may already exist, fall back to the plain form
      log.debug("Direct move failed, saving and deleting instead", e);
      save(dest, value);
      delete(src, value);
    }
  }

  protected void fail(String operation, UncheckedIOException e) {
    if (config.failOnError) throw e;
    log.warn("Failed to {} value under {}", operation, config.root, e);
  }

  @Override
  public String toString() { return "DirectoryDatabase(" + config.root + ")"; }

  /** Configuration for the directory database */
  public static class Config {
    /** The directory holding one subdirectory per key */
    public final Path root;
    /**
     * If true, throws out of save and delete when the file system fails. Otherwise logs a warning. Fetch always fails
     * on error regardless of this setting.
     */
    public final boolean failOnError;

    /** Calls other constructor with fail on error set to true */
    public Config(Path root) { this(root, true); }

    /** Build config with given values. See field descriptions for more information. */
    public Config(Path root, boolean failOnError) {
      this.root = Objects.requireNonNull(root);
      this.failOnError = failOnError;
    }
  }
}
