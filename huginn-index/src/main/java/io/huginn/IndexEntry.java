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

import static io.huginn.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable snapshot of the issues indexed against a single source file. Updates are made by
 * deriving new entries through {@link #withIssue(String, IssueStatus)} and {@link
 * #withoutIssue(String)}.
 */
public final class IndexEntry {
  private final String key;
  private final Map<String, IssueStatus> issues;

  private IndexEntry(String key, Map<String, IssueStatus> issues) {
    this.key = key;
    this.issues = Collections.unmodifiableMap(issues);
  }

  /** Returns an entry for the given key with no issues. */
  public static IndexEntry empty(String key) {
    return new IndexEntry(requireNonNull(key), new TreeMap<>());
  }

  public static IndexEntry of(String key, Map<String, IssueStatus> issues) {
    return new IndexEntry(requireNonNull(key), new TreeMap<>(issues));
  }

  /** Returns the relative file path this entry is indexed under. */
  public String key() {
    return key;
  }

  /** Returns an unmodifiable map from issue ids to their status, ordered by issue id. */
  public Map<String, IssueStatus> issues() {
    return issues;
  }

  public Optional<IssueStatus> status(String issueId) {
    return Optional.ofNullable(issues.get(issueId));
  }

  public boolean has(String issueId) {
    return issues.containsKey(issueId);
  }

  public boolean isEmpty() {
    return issues.isEmpty();
  }

  public int size() {
    return issues.size();
  }

  /** Returns an entry that maps the given issue to the given status. */
  public IndexEntry withIssue(String issueId, IssueStatus status) {
    requireNonNull(issueId);
    requireNonNull(status);
    if (status == issues.get(issueId)) {
      return this;
    }
    var updated = new TreeMap<>(issues);
    updated.put(issueId, status);
    return new IndexEntry(key, updated);
  }

  /** Returns an entry without the given issue, or this entry if it doesn't have it. */
  public IndexEntry withoutIssue(String issueId) {
    if (!issues.containsKey(issueId)) {
      return this;
    }
    var updated = new TreeMap<>(issues);
    updated.remove(issueId);
    return new IndexEntry(key, updated);
  }

  /**
   * Returns an entry containing the issues of both entries. Statuses of {@code other} win for
   * issues present in both.
   */
  public IndexEntry mergedWith(IndexEntry other) {
    requireArgument(key.equals(other.key), "merging entries of different keys");
    var merged = new TreeMap<>(issues);
    merged.putAll(other.issues);
    return new IndexEntry(key, merged);
  }

  @Override
  public int hashCode() {
    return 31 * key.hashCode() + issues.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof IndexEntry)) {
      return false;
    }
    var other = (IndexEntry) obj;
    return key.equals(other.key) && issues.equals(other.issues);
  }

  @Override
  public String toString() {
    return "IndexEntry[" + key + "]" + issues;
  }
}
