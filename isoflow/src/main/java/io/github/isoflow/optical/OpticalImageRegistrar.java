package io.github.isoflow.optical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.isoflow.client.ImageKind;
import io.github.isoflow.client.ImageStorageType;
import io.github.isoflow.client.ImageStore;
import io.github.isoflow.client.StoredImage;
import io.github.isoflow.converter.ImageIdsConverter;
import io.github.isoflow.dao.DatasetDao;
import io.github.isoflow.dao.IsoImageDao;
import io.github.isoflow.dao.OpticalImageDao;
import io.github.isoflow.exception.DatasetNotFoundException;
import io.github.isoflow.manager.DatasetManager;
import io.github.isoflow.model.Configuration;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.ImmutableOpticalImageSet;
import io.github.isoflow.model.ImmutableOpticalTile;
import io.github.isoflow.model.OpticalImageSet;
import io.github.isoflow.model.OpticalTile;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers a raw optical image with a dataset and derives the zoomed tiles the web
 * application overlays on annotation images.
 */
@Singleton
public class OpticalImageRegistrar {

  /**
   * Name of the executor resampling zoom levels.
   */
  public static final String OPTICAL_EXECUTOR = "opticalImageExecutor";

  private static final Logger log = LoggerFactory.getLogger(OpticalImageRegistrar.class);
  private static final TypeReference<List<List<Double>>> TRANSFORM = new TypeReference<>() {
  };

  private final Configuration configuration;
  private final DatasetManager datasetManager;
  private final DatasetDao datasetDao;
  private final IsoImageDao isoImageDao;
  private final OpticalImageDao opticalImageDao;
  private final ImageStore imageStore;
  private final ImageIdsConverter imageIdsConverter;
  private final PerspectiveWarp perspectiveWarp;
  private final JpegCodec jpegCodec;
  private final ObjectMapper objectMapper;
  private final ExecutorService executor;

  /**
   * Instantiates a new Optical image registrar.
   *
   * @param configuration     the configuration
   * @param datasetManager    the dataset manager
   * @param datasetDao        the dataset dao
   * @param isoImageDao       the iso image dao
   * @param opticalImageDao   the optical image dao
   * @param imageStore        the image store
   * @param imageIdsConverter the image ids converter
   * @param perspectiveWarp   the perspective warp
   * @param jpegCodec         the jpeg codec
   * @param objectMapper      the object mapper
   * @param executor          the executor resampling zoom levels
   */
  @Inject
  public OpticalImageRegistrar(final Configuration configuration,
                               final DatasetManager datasetManager,
                               final DatasetDao datasetDao,
                               final IsoImageDao isoImageDao,
                               final OpticalImageDao opticalImageDao,
                               final ImageStore imageStore,
                               final ImageIdsConverter imageIdsConverter,
                               final PerspectiveWarp perspectiveWarp,
                               final JpegCodec jpegCodec,
                               final ObjectMapper objectMapper,
                               @Named(OPTICAL_EXECUTOR) final ExecutorService executor) {
    this.configuration = configuration;
    this.datasetManager = datasetManager;
    this.datasetDao = datasetDao;
    this.isoImageDao = isoImageDao;
    this.opticalImageDao = opticalImageDao;
    this.imageStore = imageStore;
    this.imageIdsConverter = imageIdsConverter;
    this.perspectiveWarp = perspectiveWarp;
    this.jpegCodec = jpegCodec;
    this.objectMapper = objectMapper;
    this.executor = executor;
  }

  /**
   * Add an optical image at the configured zoom levels.
   *
   * @param dataset    the dataset
   * @param rawImageId id of the raw optical image in the image store
   * @param transform  3x3 transform from the annotation image grid to the raw image
   */
  public void addOpticalImage(final Dataset dataset, final String rawImageId, final List<List<Double>> transform) {
    addOpticalImage(dataset, rawImageId, transform, configuration.opticalZoomLevels());
  }

  /**
   * Add an optical image: store the raw image reference and transform, then replace the
   * zoomed tiles of the dataset.
   *
   * @param dataset    the dataset
   * @param rawImageId id of the raw optical image in the image store
   * @param transform  3x3 transform from the annotation image grid to the raw image
   * @param zoomLevels the zoom levels
   * @throws DatasetNotFoundException if the dataset has no isotope images yet
   */
  public void addOpticalImage(final Dataset dataset,
                              final String rawImageId,
                              final List<List<Double>> transform,
                              final List<Integer> zoomLevels) {
    log.info("Adding optical image to {}", dataset.id());
    perspectiveWarp.validate(transform);
    addRawOpticalImage(dataset, rawImageId, transform);
    addZoomOpticalImages(dataset, rawImageId, transform, zoomLevels);
  }

  /**
   * Delete the raw optical image, its tiles and the transform. Nothing stored is a no-op.
   *
   * @param dataset the dataset
   */
  public void deleteOpticalImage(final Dataset dataset) {
    log.info("Deleting optical image of {}", dataset.id());
    datasetDao.findRawOpticalImageId(dataset.id())
        .ifPresent(id -> imageStore.deleteImageById(ImageStorageType.FS, ImageKind.RAW_OPTICAL_IMAGE, id));
    for (final OpticalTile tile : opticalImageDao.findByDataset(dataset.id())) {
      imageStore.deleteImageById(ImageStorageType.FS, ImageKind.OPTICAL_IMAGE, tile.id());
    }
    datasetDao.clearRawOpticalImage(dataset.id());
    opticalImageDao.deleteByDataset(dataset.id());
  }

  /**
   * Optical imagery registered for a dataset.
   *
   * @param dsId the dataset id
   * @return the optical image set, empty when nothing is registered
   */
  public OpticalImageSet opticalImage(final String dsId) {
    final ImmutableOpticalImageSet.Builder builder = ImmutableOpticalImageSet.builder()
        .rawImageId(datasetDao.findRawOpticalImageId(dsId))
        .transform(datasetDao.findOpticalTransform(dsId).map(this::readTransform));
    for (final OpticalTile tile : opticalImageDao.findByDataset(dsId)) {
      builder.putTiles(tile.zoom(), tile.id());
    }
    return builder.build();
  }

  private void addRawOpticalImage(final Dataset dataset, final String rawImageId,
                                  final List<List<Double>> transform) {
    final Optional<String> previous = datasetDao.findRawOpticalImageId(dataset.id());
    if (previous.isPresent() && !previous.get().equals(rawImageId)) {
      log.info("Replacing raw optical image {} of {}", previous.get(), dataset.id());
      imageStore.deleteImageById(ImageStorageType.FS, ImageKind.RAW_OPTICAL_IMAGE, previous.get());
    }
    datasetDao.updateRawOpticalImage(dataset.id(), rawImageId, writeTransform(transform));
  }

  private void addZoomOpticalImages(final Dataset dataset,
                                    final String rawImageId,
                                    final List<List<Double>> transform,
                                    final List<Integer> zoomLevels) {
    final StoredImage shape = annotationImageShape(dataset);
    final StoredImage raw = imageStore.getImageById(ImageStorageType.FS, ImageKind.RAW_OPTICAL_IMAGE, rawImageId);
    final BufferedImage source = jpegCodec.decode(raw.bytes());

    final List<Future<OpticalTile>> futures = new ArrayList<>();
    for (final Integer zoom : zoomLevels) {
      futures.add(executor.submit(() -> scaledTile(dataset, source, transform, shape, zoom)));
    }
    final List<OpticalTile> tiles = new ArrayList<>();
    for (final Future<OpticalTile> future : futures) {
      tiles.add(await(future));
    }

    for (final OpticalTile old : opticalImageDao.findByDataset(dataset.id())) {
      imageStore.deleteImageById(ImageStorageType.FS, ImageKind.OPTICAL_IMAGE, old.id());
    }
    opticalImageDao.replace(dataset.id(), tiles);
    log.info("Stored {} optical image tiles for {}", tiles.size(), dataset.id());
  }

  private OpticalTile scaledTile(final Dataset dataset,
                                 final BufferedImage source,
                                 final List<List<Double>> transform,
                                 final StoredImage shape,
                                 final int zoom) {
    final int effective = ViewportZoom.effectiveZoom(zoom, shape.width(), shape.height());
    final double[] coefficients = perspectiveWarp.coefficients(transform, effective);
    final BufferedImage scaled = perspectiveWarp.warp(source, coefficients,
        shape.width() * effective, shape.height() * effective);
    final String id = imageStore.postImage(ImageStorageType.FS, ImageKind.OPTICAL_IMAGE, jpegCodec.encode(scaled));
    log.debug("Zoom {} of {} stored as {} ({}x)", zoom, dataset.id(), id, effective);
    return ImmutableOpticalTile.of(id, dataset.id(), zoom);
  }

  private StoredImage annotationImageShape(final Dataset dataset) {
    log.info("Querying annotation image shape for {}", dataset.id());
    final String isoImageId = isoImageDao.findIsoImageIds(dataset.id()).stream()
        .flatMap(ids -> imageIdsConverter.toIds(ids).stream())
        .filter(Objects::nonNull)
        .findFirst()
        .orElseThrow(() -> new DatasetNotFoundException("No isotope images for dataset: " + dataset.id()));
    final ImageStorageType storageType = datasetManager.ionImageStorageType(dataset.id()).get();
    final StoredImage image = imageStore.getImageById(storageType, ImageKind.ISO_IMAGE, isoImageId);
    log.info("Annotation image shape for {} is {}x{}", dataset.id(), image.width(), image.height());
    return image;
  }

  private static OpticalTile await(final Future<OpticalTile> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while resampling optical image", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new IllegalStateException("Optical image resampling failed", e.getCause());
    }
  }

  private String writeTransform(final List<List<Double>> transform) {
    try {
      return objectMapper.writeValueAsString(transform);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write transform", e);
    }
  }

  private List<List<Double>> readTransform(final String json) {
    try {
      return objectMapper.readValue(json, TRANSFORM);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt optical transform: " + json, e);
    }
  }
}
