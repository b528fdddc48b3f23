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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * In-memory table from shard hashes to the entries held in each shard. Each cached entry carries a
 * dirty flag that is set when the entry changes in memory and cleared when its shard is written.
 * The cache is only authoritative for shards that have been loaded; a missing shard may still
 * exist on disk.
 *
 * <p>Not thread-safe.
 */
public final class ShardCache {
  private final Map<String, Bucket> buckets = new LinkedHashMap<>();

  public ShardCache() {}

  public boolean isLoaded(String shardHash) {
    return buckets.containsKey(shardHash);
  }

  public @Nullable Bucket bucket(String shardHash) {
    return buckets.get(shardHash);
  }

  /** Caches the given entries as the clean content of the given shard. */
  public Bucket load(String shardHash, Map<String, IndexEntry> entries) {
    var bucket = new Bucket(shardHash);
    entries.values().forEach(entry -> bucket.put(entry, false));
    buckets.put(shardHash, bucket);
    return bucket;
  }

  /** Returns the cached bucket of the given shard, creating an empty one if absent. */
  public Bucket bucketOrEmpty(String shardHash) {
    return buckets.computeIfAbsent(shardHash, Bucket::new);
  }

  /**
   * Records that the given shard has been written with its cached entries plus the given entry.
   */
  public Bucket commit(String shardHash, IndexEntry entry) {
    var bucket = bucketOrEmpty(shardHash);
    bucket.put(entry, false);
    markPersisted(bucket);
    return bucket;
  }

  /** Returns the buckets having at least one dirty entry. */
  public List<Bucket> dirtyBuckets() {
    var dirty = new ArrayList<Bucket>();
    for (var bucket : buckets.values()) {
      if (bucket.isDirty()) {
        dirty.add(bucket);
      }
    }
    return dirty;
  }

  /**
   * Marks the given bucket as persisted: clears dirty flags and forgets entries that have no
   * issues left, forgetting the bucket itself if it becomes empty.
   */
  public void markPersisted(Bucket bucket) {
    bucket.slots.values().removeIf(slot -> slot.entry.isEmpty());
    bucket.slots.values().forEach(slot -> slot.dirty = false);
    if (bucket.slots.isEmpty()) {
      buckets.remove(bucket.shardHash, bucket);
    }
  }

  public Set<String> shardHashes() {
    return Set.copyOf(buckets.keySet());
  }

  /**
   * Returns a fresh map of every cached entry keyed by its file key. If a key is found in more than
   * one bucket, the most recently loaded bucket wins.
   */
  public Map<String, IndexEntry> allEntries() {
    var all = new HashMap<String, IndexEntry>();
    for (var bucket : buckets.values()) {
      bucket.slots.forEach((key, slot) -> all.put(key, slot.entry));
    }
    return all;
  }

  public void clear() {
    buckets.clear();
  }

  /** The cached content of a single shard. */
  public static final class Bucket {
    private final String shardHash;
    private final Map<String, Slot> slots = new LinkedHashMap<>();

    Bucket(String shardHash) {
      this.shardHash = requireNonNull(shardHash);
    }

    public String shardHash() {
      return shardHash;
    }

    public Optional<IndexEntry> get(String key) {
      var slot = slots.get(key);
      return Optional.ofNullable(slot != null ? slot.entry : null);
    }

    /** Puts the given entry and marks it dirty. */
    public void update(IndexEntry entry) {
      put(entry, true);
    }

    void put(IndexEntry entry, boolean dirty) {
      slots.put(entry.key(), new Slot(entry, dirty));
    }

    public boolean isDirty(String key) {
      var slot = slots.get(key);
      return slot != null && slot.dirty;
    }

    public boolean isDirty() {
      return slots.values().stream().anyMatch(slot -> slot.dirty);
    }

    /** Returns the number of distinct keys in this shard. */
    public int keyCount() {
      return slots.size();
    }

    /** Returns a snapshot of this shard's entries. */
    public List<IndexEntry> entries() {
      var entries = new ArrayList<IndexEntry>(slots.size());
      slots.values().forEach(slot -> entries.add(slot.entry));
      return entries;
    }
  }

  private static final class Slot {
    final IndexEntry entry;
    boolean dirty;

    Slot(IndexEntry entry, boolean dirty) {
      this.entry = entry;
      this.dirty = dirty;
    }
  }
}
