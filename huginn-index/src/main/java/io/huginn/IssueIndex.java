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

import static io.huginn.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.huginn.internal.index.IntegrityChecker;
import io.huginn.internal.index.ShardCache;
import io.huginn.internal.index.ShardCodec;
import io.huginn.internal.index.ShardFiles;
import io.huginn.internal.index.ShardMigrator;
import io.huginn.internal.index.Sharder;
import io.huginn.internal.index.Sharder.Hasher;
import java.io.Flushable;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An index from file keys to the issues referencing them, persisted as sharded files under the
 * issue directory. A key is mapped to a shard by the first {@link IndexSettings#hashLength()} hex
 * characters of its SHA-256 digest, and the shard lives at {@code .index/<first 3 chars>/<hash>}.
 *
 * <p>Issue creation is written through to disk immediately. Status transitions and removals only
 * update the in-memory cache and are persisted on the next {@link #flush()}, or when the index is
 * {@link #close() closed}. Shards are loaded lazily as keys are looked up, or all at once with
 * {@link #fullScan()}.
 *
 * <p>Changing the hash length re-shards the index through {@link #migrate(int)}, or implicitly
 * through {@link #reconfigure(IndexSettings)}. A failed migration leaves the index serving its old
 * hash length, and is retried by migrating again.
 *
 * <p>An {@code IssueIndex} is not thread-safe.
 */
public final class IssueIndex implements Flushable, AutoCloseable {
  private static final Logger logger = System.getLogger(IssueIndex.class.getName());

  private final Sharder sharder;
  private final Listener listener;
  private final ShardCache cache = new ShardCache();
  private IndexSettings settings;
  private boolean collisionNoticed;
  private boolean ignoreMarkerWritten;
  private boolean closed;

  private IssueIndex(Builder builder) {
    sharder = new Sharder(requireNonNullElse(builder.hasher, Hasher.SHA_256));
    listener = requireNonNullElse(builder.listener, DisabledListener.INSTANCE);
    settings = requireNonNullElse(builder.settings, IndexSettings.unavailable());
  }

  /** Returns the settings the index currently serves. */
  public IndexSettings settings() {
    return settings;
  }

  /** Returns the entry of the given key, loading its shard if not yet cached. */
  public Optional<IndexEntry> get(String key) throws IOException {
    requireNonNull(key);
    requireNotClosed();
    var bucket = lookupBucket(key);
    return bucket != null ? bucket.get(key) : Optional.empty();
  }

  /**
   * Indexes the given issue as {@link IssueStatus#OPEN open} under the given key, and writes the
   * key's shard immediately. If the shard can't be written, the cache is left as it was.
   *
   * @throws IllegalArgumentException if the key or issue id can't be represented in a shard
   * @throws IndexUnavailableException if no issue directory is configured
   */
  @CanIgnoreReturnValue
  public IndexEntry create(String key, String issueId) throws IOException {
    ShardCodec.requireValidKey(key);
    ShardCodec.requireValidIssueId(issueId);
    requireNotClosed();
    var issueRoot = requireIssueRoot();
    var shardHash = sharder.computeHash(key, settings.hashLength());
    var bucket = loadBucket(issueRoot, shardHash);

    var entries = new LinkedHashMap<String, IndexEntry>();
    if (bucket != null) {
      bucket.entries().forEach(entry -> entries.put(entry.key(), entry));
    }
    var entry =
        entries.getOrDefault(key, IndexEntry.empty(key)).withIssue(issueId, IssueStatus.OPEN);
    entries.put(key, entry);
    if (entries.size() > 1) {
      noticeCollision(shardHash, entries.keySet());
    }

    writeIgnoreMarkerOnce(issueRoot);
    ShardFiles.write(Sharder.shardPath(issueRoot, shardHash), entries.values());
    cache.commit(shardHash, entry);
    return entry;
  }

  /**
   * Sets the status of an indexed issue. The change is persisted on the next flush.
   *
   * @throws IssueNotIndexedException if the key has no entry or the issue isn't indexed under it
   */
  @CanIgnoreReturnValue
  public IndexEntry transition(String key, String issueId, IssueStatus status)
      throws IOException, IssueNotIndexedException {
    requireNonNull(issueId);
    requireNonNull(status);
    requireNotClosed();
    var bucket = lookupBucket(key);
    var entry = bucket != null ? bucket.get(key).orElse(null) : null;
    if (bucket == null || entry == null) {
      throw IssueNotIndexedException.noEntry(key);
    }
    if (!entry.has(issueId)) {
      throw IssueNotIndexedException.noIssue(key, issueId);
    }
    var updated = entry.withIssue(issueId, status);
    bucket.update(updated);
    return updated;
  }

  /** Transitions the given issue to {@link IssueStatus#CLOSED closed}. */
  @CanIgnoreReturnValue
  public IndexEntry closeIssue(String key, String issueId)
      throws IOException, IssueNotIndexedException {
    return transition(key, issueId, IssueStatus.CLOSED);
  }

  /** Transitions the given issue to {@link IssueStatus#OPEN open}. */
  @CanIgnoreReturnValue
  public IndexEntry reopenIssue(String key, String issueId)
      throws IOException, IssueNotIndexedException {
    return transition(key, issueId, IssueStatus.OPEN);
  }

  /**
   * Removes an issue from the entry of the given key. Returns {@code false} if the issue isn't
   * indexed under the key. The change is persisted on the next flush, which deletes the key's
   * section, or its whole shard, if nothing is left.
   *
   * @throws IssueNotIndexedException if the key has no entry
   */
  @CanIgnoreReturnValue
  public boolean remove(String key, String issueId) throws IOException, IssueNotIndexedException {
    requireNonNull(issueId);
    requireNotClosed();
    var bucket = lookupBucket(key);
    var entry = bucket != null ? bucket.get(key).orElse(null) : null;
    if (bucket == null || entry == null) {
      throw IssueNotIndexedException.noEntry(key);
    }
    if (!entry.has(issueId)) {
      return false;
    }
    bucket.update(entry.withoutIssue(issueId));
    return true;
  }

  /**
   * Writes every shard having pending changes. All shards are attempted even if some fail, in
   * which case the first failure is thrown with the others suppressed, and the failed shards stay
   * pending.
   */
  @Override
  public void flush() throws IOException {
    requireNotClosed();
    flushPending(requireIssueRoot());
  }

  /**
   * Discards the cache, including pending changes, and reloads it from every shard on disk.
   * Temp files left by interrupted writes are deleted. Returns the number of entries loaded, which
   * is {@code 0} if the index directory doesn't exist.
   */
  @CanIgnoreReturnValue
  public int fullScan() throws IOException {
    requireNotClosed();
    var issueRoot = requireIssueRoot();
    var indexDirectory = Sharder.indexDirectory(issueRoot);
    cache.clear();
    ShardFiles.deleteStaleTempFiles(indexDirectory);

    // Shards named at the current hash length are loaded last so that their entries win.
    int liveLength = settings.hashLength();
    var shardFiles = new ArrayList<>(ShardFiles.listShardFiles(indexDirectory));
    shardFiles.sort(
        Comparator.comparing((Path file) -> filenameOf(file).length() == liveLength));
    int loaded = 0;
    for (var shardFile : shardFiles) {
      var entries = ShardFiles.read(shardFile);
      if (entries.isPresent() && !entries.get().isEmpty()) {
        cache.load(filenameOf(shardFile), entries.get());
        loaded += entries.get().size();
      }
    }

    int count = loaded;
    logger.log(Level.DEBUG, () -> "Loaded " + count + " entries from <" + indexDirectory + ">");
    return count;
  }

  /**
   * Returns a copy of every cached entry keyed by file key. Only loaded shards are included, so
   * callers wanting the whole index should {@link #fullScan()} first.
   */
  public Map<String, IndexEntry> allEntries() {
    requireNotClosed();
    return cache.allEntries();
  }

  /** Whether any shard on disk is named with a hash length other than the given one. */
  public boolean needsMigration(int hashLength) throws IOException {
    requireNotClosed();
    return new ShardMigrator(requireIssueRoot(), sharder).needsMigration(hashLength);
  }

  /**
   * Re-shards the index to the given hash length, clamped to [16, 64]. Pending changes are flushed
   * first. On success, the index serves the new hash length and its cache is reloaded from disk.
   *
   * @throws MigrationException if a shard can't be written, in which case the index keeps serving
   *     its old hash length
   */
  @CanIgnoreReturnValue
  public MigrationReport migrate(int hashLength) throws IOException {
    requireNotClosed();
    var issueRoot = requireIssueRoot();
    int targetLength = Sharder.clampHashLength(hashLength);
    flushPending(issueRoot);

    var migrator = new ShardMigrator(issueRoot, sharder);
    var plan = migrator.plan(targetLength, settings.hashLength());
    cache.clear();
    MigrationReport report;
    try {
      report = migrator.execute(plan, this::noticeCollision);
    } catch (MigrationException e) {
      listener.onMigrationFailure(e);
      throw e;
    }
    settings = settings.withHashLength(targetLength);
    fullScan();
    return report;
  }

  /**
   * Switches the index to the given settings. Pending changes are flushed to the old issue
   * directory first. If shards on disk are named with a hash length other than the new one, the
   * index is migrated, serving the new issue directory at its old hash length until then. A
   * migration failure is logged and reported to the listener rather than thrown, leaving the index
   * on its old hash length until reconfigured again.
   */
  public void reconfigure(IndexSettings newSettings) throws IOException {
    requireNonNull(newSettings);
    requireNotClosed();
    if (newSettings.equals(settings)) {
      return;
    }

    var oldRoot = settings.issueRoot();
    if (oldRoot.isPresent()) {
      flushPending(oldRoot.get());
    }
    var newRoot = newSettings.issueRoot();
    if (newRoot.isEmpty()) {
      cache.clear();
      settings = newSettings;
      return;
    }
    if (!newRoot.equals(oldRoot)) {
      // The new hash length is only served once shards under the new root are named with it.
      cache.clear();
      ignoreMarkerWritten = false;
      settings = IndexSettings.of(newRoot.get(), settings.hashLength());
    }

    if (new ShardMigrator(newRoot.get(), sharder).needsMigration(newSettings.hashLength())) {
      try {
        migrate(newSettings.hashLength());
      } catch (MigrationException e) {
        logger.log(
            Level.WARNING,
            "Index stays at hash length " + settings.hashLength() + " after failed migration",
            e);
      }
    } else {
      settings = newSettings;
    }
  }

  /**
   * Flushes pending changes then evicts issues that no longer exist from the shards on disk. The
   * cache is discarded afterwards as it may hold evicted issues.
   */
  public IntegrityReport checkIntegrity(IssueExistence existence) throws IOException {
    requireNonNull(existence);
    requireNotClosed();
    var issueRoot = requireIssueRoot();
    flushPending(issueRoot);
    try {
      return IntegrityChecker.check(issueRoot, existence);
    } finally {
      cache.clear();
    }
  }

  /**
   * Evicts issues that no longer exist from the index under the given issue directory, without
   * going through an {@code IssueIndex}.
   */
  public static IntegrityReport checkIntegrity(Path issueRoot, IssueExistence existence)
      throws IOException {
    return IntegrityChecker.check(issueRoot, existence);
  }

  /** Flushes pending changes, if an issue directory is configured, and closes this index. */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    try {
      var issueRoot = settings.issueRoot();
      if (issueRoot.isPresent()) {
        flushPending(issueRoot.get());
      }
    } finally {
      closed = true;
      cache.clear();
    }
  }

  private void flushPending(Path issueRoot) throws IOException {
    @Nullable IOException failure = null;
    for (var bucket : cache.dirtyBuckets()) {
      try {
        var entries = bucket.entries();
        if (entries.stream().anyMatch(entry -> !entry.isEmpty())) {
          writeIgnoreMarkerOnce(issueRoot);
        }
        ShardFiles.write(Sharder.shardPath(issueRoot, bucket.shardHash()), entries);
        cache.markPersisted(bucket);
      } catch (IOException e) {
        logger.log(Level.WARNING, "Couldn't flush shard " + bucket.shardHash(), e);
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private ShardCache.@Nullable Bucket lookupBucket(String key) throws IOException {
    requireNonNull(key);
    var issueRoot = requireIssueRoot();
    return loadBucket(issueRoot, sharder.computeHash(key, settings.hashLength()));
  }

  private ShardCache.@Nullable Bucket loadBucket(Path issueRoot, String shardHash)
      throws IOException {
    var bucket = cache.bucket(shardHash);
    if (bucket == null) {
      var entries = ShardFiles.read(Sharder.shardPath(issueRoot, shardHash));
      if (entries.isPresent()) {
        bucket = cache.load(shardHash, entries.get());
      }
    }
    return bucket;
  }

  private void noticeCollision(String shardHash, Set<String> keys) {
    if (collisionNoticed) {
      return;
    }
    collisionNoticed = true;
    logger.log(
        Level.WARNING,
        "Hash collision in shard "
            + shardHash
            + " between keys "
            + keys
            + ", consider increasing the hash length");
    listener.onCollision(shardHash, Set.copyOf(keys));
  }

  private void writeIgnoreMarkerOnce(Path issueRoot) {
    if (ignoreMarkerWritten) {
      return;
    }
    ignoreMarkerWritten = true;
    try {
      ShardFiles.writeIgnoreMarker(Sharder.indexDirectory(issueRoot));
    } catch (IOException e) {
      logger.log(Level.WARNING, "Couldn't write the index's ignore marker", e);
    }
  }

  private Path requireIssueRoot() {
    return settings.issueRoot().orElseThrow(IndexUnavailableException::new);
  }

  private void requireNotClosed() {
    requireState(!closed, "closed");
  }

  private static String filenameOf(Path file) {
    return String.valueOf(file.getFileName());
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Receives notable index events. */
  public interface Listener {

    /**
     * Called the first time, per index instance, a shard is found holding more than one key.
     */
    default void onCollision(String shardHash, Set<String> keys) {}

    /** Called when a migration fails. */
    default void onMigrationFailure(MigrationException exception) {}

    static Listener disabled() {
      return DisabledListener.INSTANCE;
    }
  }

  private enum DisabledListener implements Listener {
    INSTANCE
  }

  /** A builder of {@code IssueIndex} instances. */
  public static final class Builder {
    private @MonotonicNonNull IndexSettings settings;
    private @MonotonicNonNull Hasher hasher;
    private @MonotonicNonNull Listener listener;

    Builder() {}

    /** Sets the issue directory and hash length. Defaults to an unavailable index. */
    @CanIgnoreReturnValue
    public Builder settings(IndexSettings settings) {
      this.settings = requireNonNull(settings);
      return this;
    }

    /** Sets the issue directory, with the hash length from {@link IndexSettings#of(Path)}. */
    @CanIgnoreReturnValue
    public Builder issueRoot(Path issueRoot) {
      return settings(IndexSettings.of(issueRoot));
    }

    /** Sets the function mapping keys to hex digests. Defaults to SHA-256. */
    @CanIgnoreReturnValue
    public Builder hasher(Hasher hasher) {
      this.hasher = requireNonNull(hasher);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder listener(Listener listener) {
      this.listener = requireNonNull(listener);
      return this;
    }

    public IssueIndex build() {
      return new IssueIndex(this);
    }
  }
}
