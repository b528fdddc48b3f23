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

import static io.huginn.IssueStatus.CLOSED;
import static io.huginn.IssueStatus.OPEN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import io.huginn.IndexEntry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ShardCodecTest {
  @Test
  void parseSections() {
    var entries =
        ShardCodec.parse(
            "[src/a.x]\n"
                + "20260110_111401 = open\n"
                + "20260112_093000 = closed\n"
                + "\n"
                + "[src/b.x]\n"
                + "20260111_120000 = open\n");
    assertThat(entries)
        .containsExactly(
            Map.entry(
                "src/a.x",
                IndexEntry.of(
                    "src/a.x", Map.of("20260110_111401", OPEN, "20260112_093000", CLOSED))),
            Map.entry("src/b.x", IndexEntry.of("src/b.x", Map.of("20260111_120000", OPEN))));
  }

  @Test
  void parseSkipsCommentsAndBlankLines() {
    var entries =
        ShardCodec.parse(
            "# generated\n"
                + "\n"
                + "   [src/a.x]\n"
                + "  # a comment\n"
                + "\t20260110_111401=open\n"
                + "\n\n");
    assertThat(entries)
        .containsOnly(
            Map.entry("src/a.x", IndexEntry.of("src/a.x", Map.of("20260110_111401", OPEN))));
  }

  @Test
  void parseDropsUnknownStatuses() {
    var entries =
        ShardCodec.parse(
            "[src/a.x]\n" + "r1 = open\n" + "r2 = resolved\n" + "r3 =\n" + "r4 = OPEN\n");
    assertThat(entries.get("src/a.x").issues()).containsOnly(Map.entry("r1", OPEN));
  }

  @Test
  void parseQuotedAndTrailingValues() {
    var entries =
        ShardCodec.parse("[src/a.x]\n" + "r1 = \"closed\"\n" + "r2 = open   ; trailing words\n");
    assertThat(entries.get("src/a.x").issues())
        .containsOnly(Map.entry("r1", CLOSED), Map.entry("r2", OPEN));
  }

  @Test
  void parseIgnoresIssueLinesOutsideSections() {
    var entries = ShardCodec.parse("r0 = open\n[src/a.x]\nr1 = open\n");
    assertThat(entries).containsOnlyKeys("src/a.x");
    assertThat(entries.get("src/a.x").issues()).containsOnlyKeys("r1");
  }

  @Test
  void parseMergesRepeatedSections() {
    var entries = ShardCodec.parse("[src/a.x]\nr1 = open\n\n[src/a.x]\nr2 = closed\n");
    assertThat(entries.get("src/a.x").issues())
        .containsOnly(Map.entry("r1", OPEN), Map.entry("r2", CLOSED));
  }

  @Test
  void parseAnyLineSeparator() {
    var entries = ShardCodec.parse("[src/a.x]\r\nr1 = open\r\n\r\n[src/b.x]\rr2 = closed\r");
    assertThat(entries).containsOnlyKeys("src/a.x", "src/b.x");
    assertThat(entries.get("src/b.x").issues()).containsOnly(Map.entry("r2", CLOSED));
  }

  @Test
  void parseKeepsSectionsWithoutIssues() {
    var entries = ShardCodec.parse("[src/a.x]\n");
    assertThat(entries).containsOnlyKeys("src/a.x");
    assertThat(entries.get("src/a.x").isEmpty()).isTrue();
  }

  @Test
  void parseEmptyContent() {
    assertThat(ShardCodec.parse("")).isEmpty();
    assertThat(ShardCodec.parse("\n# nothing\n")).isEmpty();
  }

  @Test
  void serializeSortsByKeyAndIssue() {
    var content =
        ShardCodec.serialize(
            List.of(
                IndexEntry.of("src/b.x", Map.of("r3", OPEN)),
                IndexEntry.of("src/a.x", Map.of("r2", CLOSED, "r1", OPEN))));
    assertThat(content)
        .isEqualTo(
            "[src/a.x]\n" + "r1 = open\n" + "r2 = closed\n" + "\n" + "[src/b.x]\n" + "r3 = open\n");
  }

  @Test
  void serializeOmitsEmptyEntries() {
    var content =
        ShardCodec.serialize(
            List.of(IndexEntry.empty("src/a.x"), IndexEntry.of("src/b.x", Map.of("r1", OPEN))));
    assertThat(content).isEqualTo("[src/b.x]\nr1 = open\n");
    assertThat(ShardCodec.serialize(List.of(IndexEntry.empty("src/a.x")))).isEmpty();
    assertThat(ShardCodec.serialize(List.of())).isEmpty();
  }

  @Test
  void serializedEntriesParseBack() {
    var entries =
        List.of(
            IndexEntry.of("docs/with space.md", Map.of("20260110_111401", OPEN)),
            IndexEntry.of("src/[gen.x", Map.of("a-b_c.d", CLOSED, "x", OPEN)),
            IndexEntry.of("ünïcödé", Map.of("r1", CLOSED)));
    var parsed = ShardCodec.parse(ShardCodec.serialize(entries));
    assertThat(parsed.values()).containsExactlyInAnyOrderElementsOf(entries);
  }

  @Test
  void validKeys() {
    assertThat(ShardCodec.requireValidKey("src/a.x")).isEqualTo("src/a.x");
    assertThat(ShardCodec.requireValidKey("docs/with space.md")).isEqualTo("docs/with space.md");
    assertThatIllegalArgumentException().isThrownBy(() -> ShardCodec.requireValidKey(""));
    assertThatIllegalArgumentException().isThrownBy(() -> ShardCodec.requireValidKey("  "));
    assertThatIllegalArgumentException().isThrownBy(() -> ShardCodec.requireValidKey(" src/a.x"));
    assertThatIllegalArgumentException().isThrownBy(() -> ShardCodec.requireValidKey("a]b"));
    assertThatIllegalArgumentException().isThrownBy(() -> ShardCodec.requireValidKey("a\nb"));
  }

  @Test
  void validIssueIds() {
    assertThat(ShardCodec.requireValidIssueId("20260110_111401")).isEqualTo("20260110_111401");
    assertThatIllegalArgumentException().isThrownBy(() -> ShardCodec.requireValidIssueId(""));
    assertThatIllegalArgumentException().isThrownBy(() -> ShardCodec.requireValidIssueId("a b"));
    assertThatIllegalArgumentException().isThrownBy(() -> ShardCodec.requireValidIssueId("a=b"));
    assertThatIllegalArgumentException().isThrownBy(() -> ShardCodec.requireValidIssueId("#1"));
    assertThatIllegalArgumentException().isThrownBy(() -> ShardCodec.requireValidIssueId("[1]"));
  }
}
