package io.github.isoflow.dispatch;

import io.github.isoflow.client.ImageKind;
import io.github.isoflow.client.ImageStorageType;
import io.github.isoflow.client.ImageStore;
import io.github.isoflow.client.JobFactory;
import io.github.isoflow.client.MolDbService;
import io.github.isoflow.client.RawDataStore;
import io.github.isoflow.client.SearchIndex;
import io.github.isoflow.client.StatusPublisher;
import io.github.isoflow.converter.DatasetConfigConverter;
import io.github.isoflow.converter.ImageIdsConverter;
import io.github.isoflow.dao.IsoImageDao;
import io.github.isoflow.dao.JobDao;
import io.github.isoflow.manager.DatasetManager;
import io.github.isoflow.model.ActionPriority;
import io.github.isoflow.model.Configuration;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.DatasetStatus;
import io.github.isoflow.model.DispatchMode;
import io.github.isoflow.model.ExecutionMode;
import io.github.isoflow.model.ImmutableStatusMessage;
import io.github.isoflow.model.IsotopeGenerationConfig;
import io.github.isoflow.model.JobRecord;
import io.github.isoflow.model.Lookup;
import io.github.isoflow.model.MolDbRef;
import io.github.isoflow.model.MolecularDb;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes actions in process. Used by workers consuming the action queue.
 *
 * <p>Multi-step sequences are not transactional. A failure part way leaves a state that
 * running the same action again repairs.
 */
@Singleton
public class DirectActionDispatcher implements ActionDispatcher {

  private static final Logger log = LoggerFactory.getLogger(DirectActionDispatcher.class);

  private final Configuration configuration;
  private final DatasetManager datasetManager;
  private final DatasetConfigConverter configConverter;
  private final JobDao jobDao;
  private final IsoImageDao isoImageDao;
  private final SearchIndex searchIndex;
  private final ImageStore imageStore;
  private final MolDbService molDbService;
  private final JobFactory jobFactory;
  private final RawDataStore rawDataStore;
  private final StatusPublisher statusPublisher;
  private final ImageIdsConverter imageIdsConverter;

  /**
   * Instantiates a new Direct action dispatcher.
   *
   * @param configuration   the configuration
   * @param datasetManager  the dataset manager
   * @param configConverter the config converter
   * @param jobDao          the job dao
   * @param isoImageDao     the iso image dao
   * @param searchIndex     the search index
   * @param imageStore      the image store
   * @param molDbService    the mol db service
   * @param jobFactory      the job factory
   * @param rawDataStore    the raw data store
   * @param statusPublisher the status publisher
   * @param imageIdsConverter the image ids converter
   */
  @Inject
  public DirectActionDispatcher(final Configuration configuration,
                                final DatasetManager datasetManager,
                                final DatasetConfigConverter configConverter,
                                final JobDao jobDao,
                                final IsoImageDao isoImageDao,
                                final SearchIndex searchIndex,
                                final ImageStore imageStore,
                                final MolDbService molDbService,
                                final JobFactory jobFactory,
                                final RawDataStore rawDataStore,
                                final StatusPublisher statusPublisher,
                                final ImageIdsConverter imageIdsConverter) {
    this.configuration = configuration;
    this.datasetManager = datasetManager;
    this.configConverter = configConverter;
    this.jobDao = jobDao;
    this.isoImageDao = isoImageDao;
    this.searchIndex = searchIndex;
    this.imageStore = imageStore;
    this.molDbService = molDbService;
    this.jobFactory = jobFactory;
    this.rawDataStore = rawDataStore;
    this.statusPublisher = statusPublisher;
    this.imageIdsConverter = imageIdsConverter;
  }

  @Override
  public DispatchMode mode() {
    return DispatchMode.DIRECT;
  }

  /**
   * Run an annotation job for the dataset, deleting it first if requested. Job factory
   * failures propagate unchanged.
   */
  @Override
  public void add(final Dataset dataset, final boolean delFirst, final ActionPriority priority) {
    log.info("add({}, delFirst={})", dataset.id(), delFirst);
    if (delFirst) {
      delete(dataset, false);
    }
    datasetManager.save(dataset);
    jobFactory.run(dataset);
  }

  /**
   * Reindex all results of the dataset. Jobs run against a database that is no longer
   * selected are deleted instead.
   */
  @Override
  public void update(final Dataset dataset, final ActionPriority priority) {
    log.info("update({})", dataset.id());
    final Dataset indexing = datasetManager.setStatus(dataset, DatasetStatus.INDEXING);
    searchIndex.deleteDataset(dataset.id());

    final Set<String> selected = configConverter.databases(dataset.config()).stream()
        .map(MolDbRef::name)
        .collect(Collectors.toSet());
    final IsotopeGenerationConfig isotopeGeneration = configConverter.isotopeGeneration(dataset.config());
    for (final JobRecord job : jobDao.findByDataset(dataset.id())) {
      final MolecularDb molDb = molDbService.findById(job.dbId());
      if (!selected.contains(molDb.name())) {
        log.info("Deleting job {}: {} is no longer selected for {}", job.id(), molDb.name(), dataset.id());
        jobDao.delete(job.id());
      } else {
        searchIndex.indexDataset(dataset.id(), molDb, isotopeGeneration);
      }
    }

    datasetManager.setStatus(indexing, DatasetStatus.FINISHED);
  }

  /**
   * Delete all dataset related data. Safe to call for a dataset whose row is already gone.
   */
  @Override
  public void delete(final Dataset dataset, final boolean delRawData) {
    log.warn("Deleting dataset: {} {}", dataset.id(), dataset.name());
    deleteIsoImages(dataset);
    searchIndex.deleteDataset(dataset.id());
    datasetManager.delete(dataset.id());
    if (delRawData) {
      log.warn("Deleting raw data: {}", dataset.inputPath());
      rawDataStore.deleteInputData(dataset.inputPath());
    }
    if (configuration.executionMode() == ExecutionMode.QUEUE) {
      statusPublisher.publish(ImmutableStatusMessage.of(dataset.id(), DatasetStatus.DELETED));
    }
  }

  private void deleteIsoImages(final Dataset dataset) {
    log.info("Deleting isotopic images: ({}, {})", dataset.id(), dataset.name());
    final Lookup<ImageStorageType> storageType = datasetManager.ionImageStorageType(dataset.id());
    if (storageType.isNotFound()) {
      log.warn("Attempt to delete isotopic images of non-existing dataset {}. Skipping", dataset.id());
      return;
    }
    for (final String ids : isoImageDao.findIsoImageIds(dataset.id())) {
      for (final String imageId : imageIdsConverter.toIds(ids)) {
        if (imageId != null) {
          imageStore.deleteImageById(storageType.get(), ImageKind.ISO_IMAGE, imageId);
        }
      }
    }
  }
}
