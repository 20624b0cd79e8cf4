package io.github.isoflow.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.isoflow.exception.DatasetNotFoundException;
import org.junit.jupiter.api.Test;

class LookupTest {

  @Test
  void found() {
    final Lookup<String> lookup = Lookup.found("fs");

    assertThat(lookup.isFound()).isTrue();
    assertThat(lookup.get()).isEqualTo("fs");
    assertThat(lookup.map(String::length).get()).isEqualTo(2);
  }

  @Test
  void notFound() {
    final Lookup<String> lookup = Lookup.notFound("Dataset does not exist: x");

    assertThat(lookup.isNotFound()).isTrue();
    assertThat(lookup.map(String::length).isNotFound()).isTrue();
    assertThatThrownBy(lookup::get)
        .isInstanceOf(DatasetNotFoundException.class)
        .hasMessage("Dataset does not exist: x");
  }

}
