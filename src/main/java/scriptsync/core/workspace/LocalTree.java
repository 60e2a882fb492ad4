package scriptsync.core.workspace;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import scriptsync.core.transform.LocalFile;

/** Filesystem access to a local sync folder. All paths are relative and use {@code /}. */
public final class LocalTree {
  private LocalTree() {}

  public static Path resolve(Path root, String relativePath) {
    if (relativePath == null || relativePath.isBlank()) {
      throw new IllegalArgumentException("relativePath must be non-blank.");
    }
    Path normalizedRoot = root.toAbsolutePath().normalize();
    Path resolved = normalizedRoot.resolve(relativePath).normalize();
    if (!resolved.startsWith(normalizedRoot) || resolved.equals(normalizedRoot)) {
      throw new IllegalArgumentException("Path escapes the sync folder: " + relativePath);
    }
    return resolved;
  }

  public static Optional<LocalFile> read(Path root, String relativePath) {
    Path file = resolve(root, relativePath);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new LocalFile(
              relativePath,
              Files.readAllBytes(file),
              Files.getLastModifiedTime(file).toInstant()));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read local file: " + relativePath, e);
    }
  }

  public static void write(Path root, String relativePath, byte[] content) {
    Path file = resolve(root, relativePath);
    try {
      Files.createDirectories(file.getParent());
      Files.write(file, content);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write local file: " + relativePath, e);
    }
  }

  public static void delete(Path root, String relativePath) {
    try {
      Files.deleteIfExists(resolve(root, relativePath));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete local file: " + relativePath, e);
    }
  }

  public static void setModifiedTime(Path root, String relativePath, Instant time) {
    if (time == null) {
      return;
    }
    try {
      Files.setLastModifiedTime(resolve(root, relativePath), FileTime.from(time));
    } catch (NoSuchFileException e) {
      throw new IllegalStateException("File vanished before its time could be set: " + relativePath, e);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to set modification time: " + relativePath, e);
    }
  }

  /**
   * Every regular file under {@code root}, sorted by path. Dot-directories ({@code .git},
   * {@code .git-gas} and the like) are skipped; top-level dotfiles are kept.
   */
  public static List<LocalFile> readAll(Path root) {
    if (!Files.isDirectory(root)) {
      return List.of();
    }
    List<String> paths = new ArrayList<>();
    try {
      Files.walkFileTree(
          root,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
              if (!dir.equals(root) && dir.getFileName().toString().startsWith(".")) {
                return FileVisitResult.SKIP_SUBTREE;
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (attrs.isRegularFile()) {
                paths.add(root.relativize(file).toString().replace('\\', '/'));
              }
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to walk sync folder: " + root, e);
    }

    List<LocalFile> files = new ArrayList<>(paths.size());
    for (String path : paths.stream().sorted().toList()) {
      read(root, path).ifPresent(files::add);
    }
    return files;
  }

  /** Deletes everything under {@code root} except the {@code .git} directory. */
  public static void clearExceptGit(Path root) {
    if (!Files.isDirectory(root)) {
      return;
    }
    try (Stream<Path> entries = Files.list(root)) {
      for (Path entry : entries.toList()) {
        if (!entry.getFileName().toString().equals(".git")) {
          deleteRecursively(entry);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to clear sync folder: " + root, e);
    }
  }

  public static void deleteRecursively(Path path) {
    if (!Files.exists(path)) {
      return;
    }
    try (Stream<Path> walk = Files.walk(path)) {
      for (Path entry : walk.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(entry);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete: " + path, e);
    }
  }
}
