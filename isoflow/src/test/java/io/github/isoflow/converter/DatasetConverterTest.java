package io.github.isoflow.converter;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.isoflow.DatasetFixtures;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.DatasetRow;
import io.github.isoflow.model.ImmutableDatasetRow;
import org.junit.jupiter.api.Test;

class DatasetConverterTest {

  private final DatasetConverter converter = new DatasetConverter(new ObjectMapper());

  @Test
  void toRow() {
    final DatasetRow row = converter.toRow(DatasetFixtures.dataset());

    assertThat(row.status()).isEqualTo("NEW");
    assertThat(row.publicDataset()).isTrue();
    assertThat(row.molDbs()).isEqualTo("[\"HMDB\"]");
  }

  @Test
  void toDataset_emptyMolDbs() {
    final DatasetRow row = ImmutableDatasetRow.copyOf(converter.toRow(DatasetFixtures.dataset())).withMolDbs("[]");

    final Dataset dataset = converter.toDataset(row);

    assertThat(dataset.molDbs()).isEmpty();
    assertThat(dataset.config()).isEqualTo(DatasetFixtures.config());
  }

}
