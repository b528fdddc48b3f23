/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.huginn.internal.index;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.huginn.IndexEntry;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * File operations on the shard tree. Shard writes are done on a sibling temp file that is forced
 * to disk then atomically moved over the shard file, so a shard file is either in its old or its
 * new state, never in between.
 */
public final class ShardFiles {
  private static final Logger logger = System.getLogger(ShardFiles.class.getName());

  static final String TEMP_FILE_SUFFIX = ".tmp";
  static final String IGNORE_MARKER_FILENAME = ".gitignore";
  static final String IGNORE_MARKER_CONTENT = "*\n";

  private ShardFiles() {}

  /** Reads the entries of the given shard file, or an empty optional if there's no such file. */
  public static Optional<Map<String, IndexEntry>> read(Path shardFile) throws IOException {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(shardFile);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    }
    return Optional.of(ShardCodec.parse(new String(bytes, UTF_8)));
  }

  /**
   * Writes the given entries to the given shard file, or deletes the file if none of the entries
   * has issues. Returns {@code true} if the file was written.
   */
  @CanIgnoreReturnValue
  public static boolean write(Path shardFile, Collection<IndexEntry> entries) throws IOException {
    var content = ShardCodec.serialize(entries);
    if (content.isEmpty()) {
      Files.deleteIfExists(shardFile);
      return false;
    }

    Files.createDirectories(shardFile.toAbsolutePath().getParent());
    var tempFile = tempFileOf(shardFile);
    try {
      try (var channel = FileChannel.open(tempFile, CREATE, WRITE, TRUNCATE_EXISTING)) {
        writeBytes(channel, UTF_8.encode(content));
        channel.force(false);
      }
      Files.move(tempFile, shardFile, ATOMIC_MOVE, REPLACE_EXISTING);
    } catch (IOException e) {
      deleteIfExistsQuietly(tempFile);
      throw e;
    }
    return true;
  }

  /** Returns the fanout directories under the given index directory, sorted by name. */
  public static List<Path> listFanoutDirectories(Path indexDirectory) throws IOException {
    if (!Files.isDirectory(indexDirectory)) {
      return List.of();
    }
    var directories = new ArrayList<Path>();
    try (var stream = Files.newDirectoryStream(indexDirectory, Files::isDirectory)) {
      stream.forEach(directories::add);
    } catch (DirectoryIteratorException e) {
      throw e.getCause();
    }
    Collections.sort(directories);
    return Collections.unmodifiableList(directories);
  }

  /**
   * Returns the shard files found under the given index directory, sorted by path. Temp files
   * left by interrupted writes are skipped, and so is anything else that can't be a shard.
   */
  public static List<Path> listShardFiles(Path indexDirectory) throws IOException {
    var shardFiles = new ArrayList<Path>();
    for (var fanoutDirectory : listFanoutDirectories(indexDirectory)) {
      try (var stream = Files.newDirectoryStream(fanoutDirectory)) {
        for (var file : stream) {
          var filename = filenameOf(file);
          if (filename.endsWith(TEMP_FILE_SUFFIX)) {
            continue;
          }
          if (Sharder.isShardFileName(filename) && Files.isRegularFile(file)) {
            shardFiles.add(file);
          } else {
            logger.log(Level.WARNING, "Unrecognized file or directory in the index <" + file + ">");
          }
        }
      } catch (DirectoryIteratorException e) {
        throw e.getCause();
      }
    }
    Collections.sort(shardFiles);
    return Collections.unmodifiableList(shardFiles);
  }

  /** Deletes temp files left by interrupted shard writes. Returns the number of deleted files. */
  @CanIgnoreReturnValue
  public static int deleteStaleTempFiles(Path indexDirectory) throws IOException {
    int deleted = 0;
    for (var fanoutDirectory : listFanoutDirectories(indexDirectory)) {
      try (var stream =
          Files.newDirectoryStream(
              fanoutDirectory, file -> filenameOf(file).endsWith(TEMP_FILE_SUFFIX))) {
        for (var file : stream) {
          if (Files.deleteIfExists(file)) {
            deleted++;
          }
        }
      } catch (DirectoryIteratorException e) {
        throw e.getCause();
      }
    }
    return deleted;
  }

  /** Deletes fanout directories that have become empty. */
  public static void pruneEmptyFanoutDirectories(Path indexDirectory) throws IOException {
    for (var fanoutDirectory : listFanoutDirectories(indexDirectory)) {
      boolean isEmpty;
      try (var stream = Files.newDirectoryStream(fanoutDirectory)) {
        isEmpty = !stream.iterator().hasNext();
      }
      if (isEmpty) {
        Files.deleteIfExists(fanoutDirectory);
      }
    }
  }

  /**
   * Writes a marker telling version control to ignore the index directory, unless one is already
   * there.
   */
  public static void writeIgnoreMarker(Path indexDirectory) throws IOException {
    var marker = indexDirectory.resolve(IGNORE_MARKER_FILENAME);
    if (!Files.exists(marker)) {
      Files.createDirectories(indexDirectory);
      Files.writeString(marker, IGNORE_MARKER_CONTENT);
    }
  }

  static Path tempFileOf(Path shardFile) {
    return shardFile.resolveSibling(filenameOf(shardFile) + TEMP_FILE_SUFFIX);
  }

  private static void writeBytes(FileChannel channel, ByteBuffer src) throws IOException {
    while (src.hasRemaining()) {
      channel.write(src);
    }
  }

  private static String filenameOf(Path file) {
    var filenameComponent = file.getFileName();
    return filenameComponent != null ? filenameComponent.toString() : "";
  }

  private static void deleteIfExistsQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Exception thrown when deleting: " + path, e);
    }
  }
}
