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

import static io.huginn.internal.Validate.requireArgument;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Maps index keys to shard hashes and shard files. A shard hash is a prefix of the 64-character
 * hex digest of the key, with its length clamped to {@code [16, 64]}. Shard files are fanned out
 * into directories named by the first {@value #FANOUT_PREFIX_LENGTH} characters of their hash:
 *
 * <pre>{@code <issue-root>/.index/<hash[0:3]>/<hash>}</pre>
 */
public final class Sharder {
  public static final int MIN_HASH_LENGTH = 16;
  public static final int MAX_HASH_LENGTH = 64;
  public static final int FANOUT_PREFIX_LENGTH = 3;
  public static final String INDEX_DIRECTORY_NAME = ".index";

  private final Hasher hasher;

  public Sharder(Hasher hasher) {
    this.hasher = requireNonNull(hasher);
  }

  /** Returns the shard hash of the given key at the given (clamped) length. */
  public String computeHash(String key, int hashLength) {
    requireNonNull(key);
    var digest = hasher.hexDigest(key);
    requireArgument(
        isHexDigest(digest), "hasher must return %d lower-case hex chars", MAX_HASH_LENGTH);
    return digest.substring(0, clampHashLength(hashLength));
  }

  public static int clampHashLength(int hashLength) {
    return Math.max(MIN_HASH_LENGTH, Math.min(MAX_HASH_LENGTH, hashLength));
  }

  public static Path indexDirectory(Path issueRoot) {
    return issueRoot.resolve(INDEX_DIRECTORY_NAME);
  }

  public static Path shardPath(Path issueRoot, String shardHash) {
    requireArgument(isShardFileName(shardHash), "not a shard hash: %s", shardHash);
    return indexDirectory(issueRoot)
        .resolve(shardHash.substring(0, FANOUT_PREFIX_LENGTH))
        .resolve(shardHash);
  }

  /** Whether the given file name can name a shard file, regardless of the current length. */
  public static boolean isShardFileName(String name) {
    return name.length() >= MIN_HASH_LENGTH
        && name.length() <= MAX_HASH_LENGTH
        && isLowerHex(name);
  }

  private static boolean isHexDigest(String digest) {
    return digest.length() == MAX_HASH_LENGTH && isLowerHex(digest);
  }

  private static boolean isLowerHex(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
        return false;
      }
    }
    return true;
  }

  /** A function that computes a 64-character lower-case hex digest from a key. */
  @FunctionalInterface
  public interface Hasher {
    /** A Hasher returning the hex string of the SHA-256 of the key's UTF-8 encoded bytes. */
    Hasher SHA_256 = Hasher::sha256Hex;

    String hexDigest(String key);

    private static String sha256Hex(String key) {
      var digest = sha256Digest();
      digest.update(UTF_8.encode(key));
      var bytes = digest.digest();
      var hex = new StringBuilder(2 * bytes.length);
      for (byte b : bytes) {
        hex.append(Character.forDigit((b >> 4) & 0xf, 16)).append(Character.forDigit(b & 0xf, 16));
      }
      return hex.toString();
    }

    private static MessageDigest sha256Digest() {
      try {
        return MessageDigest.getInstance("SHA-256");
      } catch (NoSuchAlgorithmException e) {
        throw new UnsupportedOperationException("SHA-256 not available!", e);
      }
    }
  }
}
