/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogTagsTest {

  @Test void with_appends() {
    LogTags tags = LogTags.of("n", "1").with("s", "2");

    assertThat(tags.currentTags()).extracting(LogTags.Tag::key).containsExactly("n", "s");
  }

  @Test void with_replacesInPlace() {
    LogTags tags = LogTags.of("n", "1").with("s", "2").with("n", "3");

    assertThat(tags.currentTags()).extracting(LogTags.Tag::value).containsExactly("3", "2");
  }

  @Test void with_doesntModifyReceiver() {
    LogTags tags = LogTags.of("n", "1");
    tags.with("s", "2");

    assertThat(tags.currentTags()).hasSize(1);
  }

  @Test void toString_omitsEmptyValues() {
    assertThat(LogTags.of("n", "1").with("client", "")).hasToString("[n=1,client]");
  }

  @Test void empty() {
    assertThat(LogTags.EMPTY.isEmpty()).isTrue();
    assertThat(LogTags.EMPTY).hasToString("[]");
  }
}
