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

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown by mutating index operations when the file they target has no entry, or when its entry
 * doesn't have the targeted issue.
 */
public final class IssueNotIndexedException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String key;
  private final @Nullable String issueId;

  private IssueNotIndexedException(String message, String key, @Nullable String issueId) {
    super(message);
    this.key = requireNonNull(key);
    this.issueId = issueId;
  }

  static IssueNotIndexedException noEntry(String key) {
    return new IssueNotIndexedException("no index entry for <" + key + ">", key, null);
  }

  static IssueNotIndexedException noIssue(String key, String issueId) {
    return new IssueNotIndexedException(
        "issue <" + issueId + "> is not indexed under <" + key + ">", key, issueId);
  }

  /** Returns the file key the failed operation targeted. */
  public String key() {
    return key;
  }

  /** Returns the targeted issue id if the entry exists but lacks the issue. */
  public Optional<String> issueId() {
    return Optional.ofNullable(issueId);
  }
}
