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

package io.huginn;

import static java.util.Objects.requireNonNull;

import io.huginn.internal.index.Sharder;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The configuration an {@link IssueIndex} operates with: the directory holding issues, under which
 * the index lives, and the number of hash characters naming each shard. The hash length is clamped
 * to {@code [16, 64]}.
 */
public final class IndexSettings {
  /** The system property consulted for the default hash length. */
  public static final String HASH_LENGTH_PROPERTY = "io.huginn.index.hashLength";

  private static final int DEFAULT_HASH_LENGTH = Sharder.MIN_HASH_LENGTH;

  private final @Nullable Path issueRoot;
  private final int hashLength;

  private IndexSettings(@Nullable Path issueRoot, int hashLength) {
    this.issueRoot = issueRoot;
    this.hashLength = Sharder.clampHashLength(hashLength);
  }

  /** Returns settings for an index under the given issue directory. */
  public static IndexSettings of(Path issueRoot, int hashLength) {
    return new IndexSettings(requireNonNull(issueRoot), hashLength);
  }

  /** Returns settings for an index under the given issue directory with the default hash length. */
  public static IndexSettings of(Path issueRoot) {
    return of(issueRoot, defaultHashLength());
  }

  /** Returns settings with no issue directory, with which every index operation is unavailable. */
  public static IndexSettings unavailable() {
    return new IndexSettings(null, defaultHashLength());
  }

  /**
   * Returns the default hash length, which is read from the {@value #HASH_LENGTH_PROPERTY} system
   * property if set, or 16 otherwise.
   */
  public static int defaultHashLength() {
    var hashLength = Integer.getInteger(HASH_LENGTH_PROPERTY);
    return hashLength != null
        ? Sharder.clampHashLength(hashLength)
        : DEFAULT_HASH_LENGTH;
  }

  public Optional<Path> issueRoot() {
    return Optional.ofNullable(issueRoot);
  }

  /** Returns the clamped hash length. */
  public int hashLength() {
    return hashLength;
  }

  /** Returns a copy of these settings with the given hash length. */
  public IndexSettings withHashLength(int hashLength) {
    return new IndexSettings(issueRoot, hashLength);
  }

  @Override
  public int hashCode() {
    return Objects.hash(issueRoot, hashLength);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof IndexSettings)) {
      return false;
    }
    var other = (IndexSettings) obj;
    return Objects.equals(issueRoot, other.issueRoot) && hashLength == other.hashLength;
  }

  @Override
  public String toString() {
    return "IndexSettings[issueRoot=" + issueRoot + ", hashLength=" + hashLength + "]";
  }
}
