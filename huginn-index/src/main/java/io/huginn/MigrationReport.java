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

/** Counters describing a completed re-sharding of the index. */
public final class MigrationReport {
  private final int hashLength;
  private final int shardsRead;
  private final int entriesMigrated;
  private final int shardsWritten;
  private final int shardsDeleted;
  private final int collisions;

  public MigrationReport(
      int hashLength,
      int shardsRead,
      int entriesMigrated,
      int shardsWritten,
      int shardsDeleted,
      int collisions) {
    this.hashLength = hashLength;
    this.shardsRead = shardsRead;
    this.entriesMigrated = entriesMigrated;
    this.shardsWritten = shardsWritten;
    this.shardsDeleted = shardsDeleted;
    this.collisions = collisions;
  }

  /** Returns the hash length shards have been migrated to. */
  public int hashLength() {
    return hashLength;
  }

  public int shardsRead() {
    return shardsRead;
  }

  public int entriesMigrated() {
    return entriesMigrated;
  }

  public int shardsWritten() {
    return shardsWritten;
  }

  public int shardsDeleted() {
    return shardsDeleted;
  }

  /** Returns the number of written shards holding more than one key. */
  public int collisions() {
    return collisions;
  }

  @Override
  public String toString() {
    return "MigrationReport[hashLength="
        + hashLength
        + ", shardsRead="
        + shardsRead
        + ", entriesMigrated="
        + entriesMigrated
        + ", shardsWritten="
        + shardsWritten
        + ", shardsDeleted="
        + shardsDeleted
        + ", collisions="
        + collisions
        + "]";
  }
}
