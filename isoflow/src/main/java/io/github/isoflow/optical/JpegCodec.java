package io.github.isoflow.optical;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Reads stored optical images and encodes resampled tiles as JPEG.
 */
@Singleton
public class JpegCodec {

  /**
   * JPEG quality of stored tiles.
   */
  public static final float QUALITY = 0.9f;

  /**
   * Instantiates a new Jpeg codec.
   */
  @Inject
  public JpegCodec() {
    // Default constructor
  }

  /**
   * Decode an image in any format ImageIO reads.
   *
   * @param bytes the encoded image
   * @return the image
   */
  public BufferedImage decode(final byte[] bytes) {
    try {
      final BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
      if (image == null) {
        throw new IllegalArgumentException("Unsupported image format");
      }
      return image;
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to decode image", e);
    }
  }

  /**
   * Encode as JPEG at {@link #QUALITY}.
   *
   * @param image the image
   * @return the JPEG bytes
   */
  public byte[] encode(final BufferedImage image) {
    final Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new IllegalStateException("No JPEG writer available");
    }
    final ImageWriter writer = writers.next();
    final ImageWriteParam param = writer.getDefaultWriteParam();
    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
    param.setCompressionQuality(QUALITY);
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
      writer.setOutput(stream);
      writer.write(null, new IIOImage(image, null, null), param);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to encode JPEG", e);
    } finally {
      writer.dispose();
    }
    return out.toByteArray();
  }
}
