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

import java.util.List;

/** The outcome of an integrity check over the shards of an index. */
public final class IntegrityReport {
  private final int checked;
  private final List<String> evictedIds;

  public IntegrityReport(int checked, List<String> evictedIds) {
    this.checked = checked;
    this.evictedIds = List.copyOf(evictedIds);
  }

  /** Returns the number of (file, issue) pairs visited. */
  public int checked() {
    return checked;
  }

  /** Returns the number of (file, issue) pairs evicted. */
  public int evicted() {
    return evictedIds.size();
  }

  /** Returns the ids of evicted issues in the order they were evicted. */
  public List<String> evictedIds() {
    return evictedIds;
  }

  @Override
  public String toString() {
    return "IntegrityReport[checked=" + checked + ", evicted=" + evictedIds.size() + "]";
  }
}
