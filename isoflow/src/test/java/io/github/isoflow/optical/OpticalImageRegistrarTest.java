package io.github.isoflow.optical;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.isoflow.BaseJdbiTest;
import io.github.isoflow.DatasetFixtures;
import io.github.isoflow.client.ImageKind;
import io.github.isoflow.client.ImageStorageType;
import io.github.isoflow.client.ImageStore;
import io.github.isoflow.client.ImmutableStoredImage;
import io.github.isoflow.client.SearchIndex;
import io.github.isoflow.client.StatusPublisher;
import io.github.isoflow.converter.DatasetConverter;
import io.github.isoflow.converter.ImageIdsConverter;
import io.github.isoflow.dao.DatasetDao;
import io.github.isoflow.dao.IsoImageDao;
import io.github.isoflow.dao.JobDao;
import io.github.isoflow.dao.OpticalImageDao;
import io.github.isoflow.exception.DatasetNotFoundException;
import io.github.isoflow.manager.DatasetManager;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.ImmutableConfiguration;
import io.github.isoflow.model.ImmutableOpticalTile;
import io.github.isoflow.model.OpticalImageSet;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpticalImageRegistrarTest extends BaseJdbiTest {

  private static final List<List<Double>> TRANSFORM = List.of(
      List.of(0.2, 0.0, 0.0),
      List.of(0.0, 0.2, 0.0),
      List.of(0.0, 0.0, 1.0));

  private final JpegCodec jpegCodec = new JpegCodec();
  private ImageStore imageStore;
  private DatasetDao datasetDao;
  private OpticalImageDao opticalImageDao;
  private ExecutorService executor;
  private OpticalImageRegistrar registrar;
  private Dataset dataset;

  @BeforeEach
  void setup() {
    imageStore = mock(ImageStore.class);
    datasetDao = jdbi.onDemand(DatasetDao.class);
    opticalImageDao = jdbi.onDemand(OpticalImageDao.class);
    executor = Executors.newFixedThreadPool(2);
    final DatasetManager datasetManager = new DatasetManager(datasetDao, new DatasetConverter(objectMapper),
        mock(SearchIndex.class), mock(StatusPublisher.class));
    registrar = new OpticalImageRegistrar(
        ImmutableConfiguration.copyOf(configuration).withOpticalZoomLevels(List.of(1)),
        datasetManager, datasetDao, jdbi.onDemand(IsoImageDao.class), opticalImageDao, imageStore,
        new ImageIdsConverter(objectMapper), new PerspectiveWarp(), jpegCodec, objectMapper, executor);

    dataset = DatasetFixtures.dataset();
    datasetManager.save(dataset);
    final long jobId = jdbi.onDemand(JobDao.class).insert(0, dataset.id(), "FINISHED");
    jdbi.onDemand(IsoImageDao.class).insert(jobId, 0, 1, "+H", "[null,\"iso_1\"]");

    when(imageStore.getImageById(ImageStorageType.FS, ImageKind.ISO_IMAGE, "iso_1"))
        .thenReturn(ImmutableStoredImage.builder().bytes(new byte[0]).width(1000).height(500).build());
  }

  @AfterEach
  void shutdownExecutor() {
    executor.shutdownNow();
  }

  private void stubRawImage(final String id) {
    final byte[] raw = jpegCodec.encode(new BufferedImage(200, 100, BufferedImage.TYPE_INT_RGB));
    when(imageStore.getImageById(ImageStorageType.FS, ImageKind.RAW_OPTICAL_IMAGE, id))
        .thenReturn(ImmutableStoredImage.builder().bytes(raw).width(200).height(100).build());
  }

  private void stubTilePosts() {
    final AtomicInteger counter = new AtomicInteger();
    when(imageStore.postImage(eq(ImageStorageType.FS), eq(ImageKind.OPTICAL_IMAGE), any()))
        .thenAnswer(invocation -> "tile_" + counter.incrementAndGet());
  }

  @Test
  void addOpticalImage() {
    stubRawImage("raw_1");
    stubTilePosts();

    registrar.addOpticalImage(dataset, "raw_1", TRANSFORM, List.of(1, 2));

    final OpticalImageSet result = registrar.opticalImage(dataset.id());
    assertThat(result.rawImageId()).contains("raw_1");
    assertThat(result.transform()).contains(TRANSFORM);
    assertThat(result.tiles()).containsOnlyKeys(1, 2);
    assertThat(result.tiles().values()).containsExactlyInAnyOrder("tile_1", "tile_2");
    verify(imageStore, never()).deleteImageById(any(), any(), any());
  }

  @Test
  void addOpticalImage_configuredZoomLevels() {
    stubRawImage("raw_1");
    stubTilePosts();

    registrar.addOpticalImage(dataset, "raw_1", TRANSFORM);

    assertThat(registrar.opticalImage(dataset.id()).tiles()).containsOnlyKeys(1);
  }

  @Test
  void addOpticalImage_replacesPrevious() {
    stubRawImage("raw_1");
    stubTilePosts();
    datasetDao.updateRawOpticalImage(dataset.id(), "raw_0", "[[1.0,0.0,0.0],[0.0,1.0,0.0],[0.0,0.0,1.0]]");
    opticalImageDao.insert(List.of(ImmutableOpticalTile.of("old_tile", dataset.id(), 1)));

    registrar.addOpticalImage(dataset, "raw_1", TRANSFORM, List.of(1));

    verify(imageStore).deleteImageById(ImageStorageType.FS, ImageKind.RAW_OPTICAL_IMAGE, "raw_0");
    verify(imageStore).deleteImageById(ImageStorageType.FS, ImageKind.OPTICAL_IMAGE, "old_tile");
    assertThat(registrar.opticalImage(dataset.id()).tiles()).containsExactly(Map.entry(1, "tile_1"));
  }

  @Test
  void addOpticalImage_sameRawImageKept() {
    stubRawImage("raw_1");
    stubTilePosts();
    datasetDao.updateRawOpticalImage(dataset.id(), "raw_1", "[[1.0,0.0,0.0],[0.0,1.0,0.0],[0.0,0.0,1.0]]");

    registrar.addOpticalImage(dataset, "raw_1", TRANSFORM, List.of(1));

    verify(imageStore, never()).deleteImageById(ImageStorageType.FS, ImageKind.RAW_OPTICAL_IMAGE, "raw_1");
    assertThat(registrar.opticalImage(dataset.id()).transform()).contains(TRANSFORM);
  }

  @Test
  void addOpticalImage_withoutIsotopeImages() {
    final Dataset other = DatasetFixtures.dataset().withId("other");
    datasetDao.insert(new DatasetConverter(objectMapper).toRow(other));

    assertThatThrownBy(() -> registrar.addOpticalImage(other, "raw_1", TRANSFORM, List.of(1)))
        .isInstanceOf(DatasetNotFoundException.class);
  }

  @Test
  void addOpticalImage_invalidTransform() {
    assertThatThrownBy(() -> registrar.addOpticalImage(dataset, "raw_1", List.of(List.of(1.0)), List.of(1)))
        .isInstanceOf(IllegalArgumentException.class);

    assertThat(registrar.opticalImage(dataset.id()).isEmpty()).isTrue();
  }

  @Test
  void deleteOpticalImage() {
    datasetDao.updateRawOpticalImage(dataset.id(), "raw_0", "[[1.0,0.0,0.0],[0.0,1.0,0.0],[0.0,0.0,1.0]]");
    opticalImageDao.insert(List.of(
        ImmutableOpticalTile.of("tile_a", dataset.id(), 1),
        ImmutableOpticalTile.of("tile_b", dataset.id(), 2)));

    registrar.deleteOpticalImage(dataset);

    verify(imageStore).deleteImageById(ImageStorageType.FS, ImageKind.RAW_OPTICAL_IMAGE, "raw_0");
    verify(imageStore).deleteImageById(ImageStorageType.FS, ImageKind.OPTICAL_IMAGE, "tile_a");
    verify(imageStore).deleteImageById(ImageStorageType.FS, ImageKind.OPTICAL_IMAGE, "tile_b");
    final OpticalImageSet result = registrar.opticalImage(dataset.id());
    assertThat(result.isEmpty()).isTrue();
    assertThat(result.transform()).isEmpty();
  }

  @Test
  void deleteOpticalImage_nothingStored() {
    registrar.deleteOpticalImage(dataset);

    verify(imageStore, never()).deleteImageById(any(), any(), any());
  }

}
