package io.github.isoflow.manager;

import io.github.isoflow.client.ImageStorageType;
import io.github.isoflow.client.SearchIndex;
import io.github.isoflow.client.StatusPublisher;
import io.github.isoflow.converter.DatasetConverter;
import io.github.isoflow.dao.DatasetDao;
import io.github.isoflow.exception.DatasetNotFoundException;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.DatasetStatus;
import io.github.isoflow.model.ImmutableDataset;
import io.github.isoflow.model.ImmutableStatusMessage;
import io.github.isoflow.model.Lookup;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and stores datasets and moves them through their status lifecycle. Every save is
 * followed by a search index sync.
 */
@Singleton
public class DatasetManager {

  private static final Logger log = LoggerFactory.getLogger(DatasetManager.class);

  private final DatasetDao datasetDao;
  private final DatasetConverter datasetConverter;
  private final SearchIndex searchIndex;
  private final StatusPublisher statusPublisher;

  /**
   * Instantiates a new Dataset manager.
   *
   * @param datasetDao       the dataset dao
   * @param datasetConverter the dataset converter
   * @param searchIndex      the search index
   * @param statusPublisher  the status publisher
   */
  @Inject
  public DatasetManager(final DatasetDao datasetDao,
                        final DatasetConverter datasetConverter,
                        final SearchIndex searchIndex,
                        final StatusPublisher statusPublisher) {
    this.datasetDao = datasetDao;
    this.datasetConverter = datasetConverter;
    this.searchIndex = searchIndex;
    this.statusPublisher = statusPublisher;
  }

  /**
   * Load a stored dataset.
   *
   * @param id the id
   * @return the dataset
   * @throws DatasetNotFoundException if the dataset does not exist
   */
  public Dataset load(final String id) {
    log.trace("load({})", id);
    return datasetDao.find(id)
        .map(datasetConverter::toDataset)
        .orElseThrow(() -> new DatasetNotFoundException("Dataset does not exist: " + id));
  }

  /**
   * Is stored.
   *
   * @param id the id
   * @return true if a row exists
   */
  public boolean isStored(final String id) {
    return datasetDao.exists(id);
  }

  /**
   * Insert the dataset, or fully update it when already stored, then sync the search index.
   *
   * @param dataset the dataset
   * @return the dataset
   */
  public Dataset save(final Dataset dataset) {
    log.trace("save({})", dataset.id());
    validate(dataset);
    if (datasetDao.exists(dataset.id())) {
      datasetDao.update(datasetConverter.toRow(dataset));
      log.info("Updated dataset: {}, {}", dataset.id(), dataset.name());
    } else {
      datasetDao.insert(datasetConverter.toRow(dataset));
      log.info("Inserted dataset: {}, {}", dataset.id(), dataset.name());
    }
    searchIndex.syncDataset(dataset.id());
    return dataset;
  }

  /**
   * Set the status, save, and publish the change on the status channel. Any status may
   * follow any other.
   *
   * @param dataset the dataset
   * @param status  the new status
   * @return the updated dataset
   */
  public Dataset setStatus(final Dataset dataset, final DatasetStatus status) {
    log.trace("setStatus({},{})", dataset.id(), status);
    final Dataset updated = ImmutableDataset.copyOf(dataset).withStatus(status);
    save(updated);
    statusPublisher.publish(ImmutableStatusMessage.of(updated.id(), status));
    return updated;
  }

  /**
   * Delete the dataset row. Jobs, their image metrics and optical tile rows go with it.
   *
   * @param id the id
   * @return true if a row was deleted
   */
  public boolean delete(final String id) {
    log.trace("delete({})", id);
    return datasetDao.delete(id) > 0;
  }

  /**
   * Storage type of the dataset's isotope images.
   *
   * @param id the dataset id
   * @return the storage type, or not found for an unknown dataset
   */
  public Lookup<ImageStorageType> ionImageStorageType(final String id) {
    return datasetDao.findIonImageStorageType(id)
        .map(code -> Lookup.found(ImageStorageType.fromCode(code)))
        .orElseGet(() -> Lookup.notFound("Dataset does not exist: " + id));
  }

  private void validate(final Dataset dataset) {
    if (dataset.name().isBlank()
        || dataset.inputPath().isBlank()
        || dataset.config().isEmpty()
        || dataset.molDbs().isEmpty()) {
      throw new IllegalArgumentException("Dataset is incomplete and can not be stored: " + dataset);
    }
  }
}
