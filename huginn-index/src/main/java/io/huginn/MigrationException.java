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

import java.io.IOException;

/**
 * Thrown when re-sharding the index is aborted by a write failure. Shards migrated before the
 * failure stay in place and the remaining ones keep their old names. Migrating again resumes from
 * what's on disk.
 */
public final class MigrationException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int hashLength;
  private final int shardsWritten;

  public MigrationException(int hashLength, int shardsWritten, IOException cause) {
    super(
        "migration to hash length "
            + hashLength
            + " aborted after writing "
            + shardsWritten
            + " shard(s)",
        cause);
    this.hashLength = hashLength;
    this.shardsWritten = shardsWritten;
  }

  /** Returns the hash length the aborted migration targeted. */
  public int hashLength() {
    return hashLength;
  }

  /** Returns the number of shards written before the failure. */
  public int shardsWritten() {
    return shardsWritten;
  }
}
