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

import static java.util.Objects.requireNonNull;

import io.huginn.IndexEntry;
import io.huginn.IntegrityReport;
import io.huginn.IssueExistence;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Verifies that each indexed issue still exists, evicting those that don't. The check runs
 * against the shard files directly and doesn't need, nor update, an index cache.
 */
public final class IntegrityChecker {
  private static final Logger logger = System.getLogger(IntegrityChecker.class.getName());

  private IntegrityChecker() {}

  public static IntegrityReport check(Path issueRoot, IssueExistence existence)
      throws IOException {
    requireNonNull(issueRoot);
    requireNonNull(existence);
    int checked = 0;
    var evictedIds = new ArrayList<String>();
    for (var shardFile : ShardFiles.listShardFiles(Sharder.indexDirectory(issueRoot))) {
      var entries = ShardFiles.read(shardFile);
      if (entries.isEmpty()) {
        continue;
      }

      var survivors = new ArrayList<IndexEntry>();
      boolean evictedFromShard = false;
      for (var entry : entries.get().values()) {
        var surviving = entry;
        for (var issueId : entry.issues().keySet()) {
          checked++;
          if (!existence.exists(issueRoot, issueId)) {
            surviving = surviving.withoutIssue(issueId);
            evictedIds.add(issueId);
            evictedFromShard = true;
          }
        }
        survivors.add(surviving);
      }

      if (evictedFromShard) {
        boolean rewritten = ShardFiles.write(shardFile, survivors);
        logger.log(
            Level.DEBUG,
            () -> (rewritten ? "Rewrote" : "Deleted") + " shard with stale issues: " + shardFile);
      }
    }
    return new IntegrityReport(checked, evictedIds);
  }
}
