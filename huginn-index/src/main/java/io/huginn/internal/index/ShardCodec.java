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
import static java.util.Objects.requireNonNull;

import io.huginn.IndexEntry;
import io.huginn.IssueStatus;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads and writes the text content of shard files. A shard holds one section per indexed file,
 * headed by the file's key in brackets and followed by one {@code issue-id = status} line per
 * issue:
 *
 * <pre>{@code
 * [src/a.x]
 * 20260110_111401 = open
 * 20260112_093000 = closed
 *
 * [src/b.x]
 * 20260111_120000 = open
 * }</pre>
 *
 * <p>Sections are separated by a blank line. Blank lines and lines starting with {@code #} are
 * skipped on reading, and so are issue lines with an unrecognized status.
 */
public final class ShardCodec {
  private static final Pattern LINE_SEPARATOR = Pattern.compile("\r\n|\r|\n");
  private static final Pattern ISSUE_LINE = Pattern.compile("^(\\S+)\\s*=\\s*(.*)$");

  private ShardCodec() {}

  /** Parses shard content into entries keyed by their file key, in order of appearance. */
  public static Map<String, IndexEntry> parse(String content) {
    var entries = new LinkedHashMap<String, IndexEntry>();
    @Nullable String currentKey = null;
    for (var line : LINE_SEPARATOR.split(content, -1)) {
      var trimmed = line.stripLeading();
      if (trimmed.isEmpty() || trimmed.charAt(0) == '#') {
        continue;
      }

      var sectionKey = sectionKey(trimmed);
      if (sectionKey != null) {
        currentKey = sectionKey;
        entries.putIfAbsent(currentKey, IndexEntry.empty(currentKey));
        continue;
      }

      if (currentKey != null) {
        var matcher = ISSUE_LINE.matcher(trimmed);
        if (matcher.matches()) {
          var issueId = matcher.group(1);
          var value = value(matcher.group(2));
          if (value != null) {
            var key = currentKey;
            IssueStatus.tryParse(value)
                .ifPresent(status -> entries.put(key, entries.get(key).withIssue(issueId, status)));
          }
        }
      }
    }
    return entries;
  }

  /** Serializes the non-empty entries among the given ones, ordered by key. */
  public static String serialize(Collection<IndexEntry> entries) {
    var nonEmpty = new ArrayList<IndexEntry>();
    for (var entry : entries) {
      if (!entry.isEmpty()) {
        nonEmpty.add(entry);
      }
    }
    if (nonEmpty.isEmpty()) {
      return "";
    }

    nonEmpty.sort(Comparator.comparing(IndexEntry::key));
    var sb = new StringBuilder();
    for (var entry : nonEmpty) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append('[').append(entry.key()).append("]\n");
      entry
          .issues()
          .forEach(
              (issueId, status) ->
                  sb.append(issueId).append(" = ").append(status.token()).append('\n'));
    }
    return sb.toString();
  }

  /** Ensures the given key can be written as a section header and read back unchanged. */
  public static String requireValidKey(String key) {
    requireNonNull(key);
    requireArgument(
        !key.isBlank()
            && key.equals(key.strip())
            && key.indexOf(']') < 0
            && key.indexOf('\n') < 0
            && key.indexOf('\r') < 0,
        "key can't be indexed: <%s>",
        key);
    return key;
  }

  /** Ensures the given issue id can be written as an issue line and read back unchanged. */
  public static String requireValidIssueId(String issueId) {
    requireNonNull(issueId);
    boolean valid = !issueId.isEmpty() && issueId.charAt(0) != '#' && issueId.charAt(0) != '[';
    for (int i = 0; valid && i < issueId.length(); i++) {
      char c = issueId.charAt(i);
      valid = !Character.isWhitespace(c) && c != '=';
    }
    requireArgument(valid, "issue id can't be indexed: <%s>", issueId);
    return issueId;
  }

  private static @Nullable String sectionKey(String trimmedLine) {
    if (trimmedLine.charAt(0) != '[') {
      return null;
    }
    int close = trimmedLine.indexOf(']', 1);
    return close > 1 ? trimmedLine.substring(1, close) : null;
  }

  private static @Nullable String value(String rhs) {
    var value = rhs.stripLeading();
    if (value.isEmpty()) {
      return null;
    }
    if (value.charAt(0) == '"') {
      int closingQuote = value.indexOf('"', 1);
      return closingQuote >= 0 ? value.substring(1, closingQuote) : value.substring(1);
    }
    int end = 0;
    while (end < value.length() && !Character.isWhitespace(value.charAt(end))) {
      end++;
    }
    return value.substring(0, end);
  }
}
