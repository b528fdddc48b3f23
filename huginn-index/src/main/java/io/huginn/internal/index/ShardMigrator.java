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
import io.huginn.MigrationException;
import io.huginn.MigrationReport;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Re-shards the index when the hash length changes. Migration runs in two passes. The first reads
 * every shard and plans where each entry goes under the new hash length, touching nothing. The
 * second writes one shard per new hash, merging entries that now collide, then deletes the old
 * shard files and prunes emptied fanout directories.
 *
 * <p>A write failure aborts the second pass. Shards written so far stay in place and the rest keep
 * their old names. Since plans are computed from what's on disk, migrating again picks up where
 * the failed migration stopped. Once every new shard is written the migration has succeeded, and
 * old shards that can't be deleted are only logged.
 */
public final class ShardMigrator {
  private static final Logger logger = System.getLogger(ShardMigrator.class.getName());

  private final Path issueRoot;
  private final Sharder sharder;

  public ShardMigrator(Path issueRoot, Sharder sharder) {
    this.issueRoot = requireNonNull(issueRoot);
    this.sharder = requireNonNull(sharder);
  }

  /** Whether any shard file is named with a hash length other than the given (clamped) one. */
  public boolean needsMigration(int hashLength) throws IOException {
    int targetLength = Sharder.clampHashLength(hashLength);
    for (var shardFile : ShardFiles.listShardFiles(Sharder.indexDirectory(issueRoot))) {
      if (shardFile.getFileName().toString().length() != targetLength) {
        return true;
      }
    }
    return false;
  }

  /**
   * Reads the shard tree and plans its migration to the given hash length. Shards already named at
   * that length are considered live.
   */
  public Plan plan(int hashLength) throws IOException {
    return plan(hashLength, hashLength);
  }

  /**
   * Reads the shard tree and plans its migration to the given hash length. Shards named at {@code
   * liveHashLength} hold the entries the index currently serves, so their copy of a key replaces
   * copies found elsewhere.
   */
  public Plan plan(int hashLength, int liveHashLength) throws IOException {
    int targetLength = Sharder.clampHashLength(hashLength);
    int liveLength = Sharder.clampHashLength(liveHashLength);
    var shardFiles = ShardFiles.listShardFiles(Sharder.indexDirectory(issueRoot));
    var moves = new ArrayList<Move>();
    for (var shardFile : shardFiles) {
      var entries = ShardFiles.read(shardFile);
      if (entries.isEmpty()) {
        continue; // Deleted since listed.
      }
      boolean live = shardFile.getFileName().toString().length() == liveLength;
      for (var entry : entries.get().values()) {
        // Sections without issues are dropped, taking their old shard file with them if alone.
        if (!entry.isEmpty()) {
          moves.add(
              new Move(shardFile, sharder.computeHash(entry.key(), targetLength), entry, live));
        }
      }
    }
    return new Plan(targetLength, shardFiles, moves);
  }

  /**
   * Carries out the given plan. {@code onCollision} is called, after all shards are written, for
   * each new shard holding more than one key.
   */
  public MigrationReport execute(Plan plan, BiConsumer<String, Set<String>> onCollision)
      throws MigrationException {
    var indexDirectory = Sharder.indexDirectory(issueRoot);
    var writtenPaths = new HashSet<Path>();
    var collisions = new LinkedHashMap<String, Set<String>>();
    for (var group : plan.groups().entrySet()) {
      var newShardHash = group.getKey();
      var newShardPath = Sharder.shardPath(issueRoot, newShardHash);
      var merged = merge(group.getValue());
      if (merged.size() > 1) {
        collisions.put(newShardHash, Collections.unmodifiableSet(merged.keySet()));
      }

      try {
        ShardFiles.write(newShardPath, merged.values());
      } catch (IOException e) {
        logger.log(Level.ERROR, "Index migration failed when writing <" + newShardPath + ">", e);
        throw new MigrationException(plan.hashLength(), writtenPaths.size(), e);
      }
      writtenPaths.add(newShardPath);
    }

    // Every entry now lives under the new hash length, so cleanup failures are only logged.
    // Old shards left behind are stale copies that a later migration to this length replaces.
    int deleted = 0;
    for (var oldShardFile : plan.shardFiles()) {
      if (!writtenPaths.contains(oldShardFile)) {
        try {
          if (Files.deleteIfExists(oldShardFile)) {
            deleted++;
          }
        } catch (IOException e) {
          logger.log(Level.WARNING, "Couldn't delete old shard <" + oldShardFile + ">", e);
        }
      }
    }
    try {
      ShardFiles.pruneEmptyFanoutDirectories(indexDirectory);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Couldn't prune fanout directories of <" + indexDirectory + ">", e);
    }

    collisions.forEach(onCollision);
    var report =
        new MigrationReport(
            plan.hashLength(),
            plan.shardFiles().size(),
            plan.moves().size(),
            writtenPaths.size(),
            deleted,
            collisions.size());
    logger.log(Level.DEBUG, () -> "Index migrated: " + report);
    return report;
  }

  /**
   * Merges the entries moving to the same shard by key. A key is found in more than one old shard
   * only if a previous migration was interrupted. Stale copies are united, and a live copy, if any,
   * replaces them.
   */
  private static SortedMap<String, IndexEntry> merge(List<Move> moves) {
    var merged = new TreeMap<String, IndexEntry>();
    for (var move : moves) {
      if (!move.live) {
        merged.merge(move.entry.key(), move.entry, IndexEntry::mergedWith);
      }
    }
    for (var move : moves) {
      if (move.live) {
        merged.put(move.entry.key(), move.entry);
      }
    }
    return merged;
  }

  /** Where each entry found on disk goes under a new hash length. */
  public static final class Plan {
    private final int hashLength;
    private final List<Path> shardFiles;
    private final List<Move> moves;
    private final SortedMap<String, List<Move>> groups = new TreeMap<>();

    Plan(int hashLength, List<Path> shardFiles, List<Move> moves) {
      this.hashLength = hashLength;
      this.shardFiles = List.copyOf(shardFiles);
      this.moves = List.copyOf(moves);
      for (var move : moves) {
        groups.computeIfAbsent(move.newShardHash, __ -> new ArrayList<>()).add(move);
      }
    }

    public int hashLength() {
      return hashLength;
    }

    /** Returns the shard files the plan was computed from. */
    public List<Path> shardFiles() {
      return shardFiles;
    }

    public List<Move> moves() {
      return moves;
    }

    /** Returns the planned moves grouped by new shard hash, ordered by hash. */
    public SortedMap<String, List<Move>> groups() {
      return Collections.unmodifiableSortedMap(groups);
    }

    public boolean isEmpty() {
      return moves.isEmpty();
    }
  }

  /** An entry read from an old shard file along with the shard it's moving to. */
  public static final class Move {
    final Path from;
    final String newShardHash;
    final IndexEntry entry;
    final boolean live;

    Move(Path from, String newShardHash, IndexEntry entry, boolean live) {
      this.from = from;
      this.newShardHash = newShardHash;
      this.entry = entry;
      this.live = live;
    }

    public Path from() {
      return from;
    }

    public String newShardHash() {
      return newShardHash;
    }

    public String key() {
      return entry.key();
    }

    public IndexEntry entry() {
      return entry;
    }

    /** Whether the entry was read from a shard named at the live hash length. */
    public boolean isLive() {
      return live;
    }
  }
}
