package io.github.isoflow.optical;

import java.awt.image.BufferedImage;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Projective resampling of an optical image onto the annotation image grid.
 *
 * <p>The eight coefficients {@code (a, b, c, d, e, f, g, h)} map an output pixel
 * {@code (x, y)} to the source pixel
 * {@code ((a*x + b*y + c) / (g*x + h*y + 1), (d*x + e*y + f) / (g*x + h*y + 1))}.
 * Pixel centres are sampled with a bicubic kernel. Output pixels mapping outside the
 * source are black.
 */
@Singleton
public class PerspectiveWarp {

  private static final double CUBIC_A = -0.5;

  /**
   * Instantiates a new Perspective warp.
   */
  @Inject
  public PerspectiveWarp() {
    // Default constructor
  }

  /**
   * Coefficients for a 3x3 transform at the given effective zoom: the matrix is
   * normalised by its bottom right entry and its first two columns divided by the zoom.
   *
   * @param transform the row major 3x3 transform
   * @param zoom      the effective zoom
   * @return the eight coefficients
   */
  public double[] coefficients(final List<List<Double>> transform, final int zoom) {
    validate(transform);
    final double scale = transform.get(2).get(2);
    final double[] coefficients = new double[8];
    for (int i = 0; i < 8; i++) {
      final int row = i / 3;
      final int col = i % 3;
      double value = transform.get(row).get(col) / scale;
      if (col < 2) {
        value /= zoom;
      }
      coefficients[i] = value;
    }
    return coefficients;
  }

  /**
   * Check the transform is a 3x3 matrix with a non zero bottom right entry.
   *
   * @param transform the row major transform
   * @throws IllegalArgumentException if it is not
   */
  public void validate(final List<List<Double>> transform) {
    if (transform.size() != 3 || transform.stream().anyMatch(row -> row == null || row.size() != 3)) {
      throw new IllegalArgumentException("Transform must be 3x3: " + transform);
    }
    if (transform.get(2).get(2) == 0.0) {
      throw new IllegalArgumentException("Transform is not normalisable: " + transform);
    }
  }

  /**
   * Warp the source image.
   *
   * @param source       the source image
   * @param coefficients the eight coefficients
   * @param width        output width
   * @param height       output height
   * @return the RGB output image
   */
  public BufferedImage warp(final BufferedImage source,
                            final double[] coefficients,
                            final int width,
                            final int height) {
    if (coefficients.length != 8) {
      throw new IllegalArgumentException("Expected 8 coefficients, got " + coefficients.length);
    }
    final int srcWidth = source.getWidth();
    final int srcHeight = source.getHeight();
    final int[] pixels = source.getRGB(0, 0, srcWidth, srcHeight, null, 0, srcWidth);
    final BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    final double a = coefficients[0];
    final double b = coefficients[1];
    final double c = coefficients[2];
    final double d = coefficients[3];
    final double e = coefficients[4];
    final double f = coefficients[5];
    final double g = coefficients[6];
    final double h = coefficients[7];

    for (int y = 0; y < height; y++) {
      final double yc = y + 0.5;
      for (int x = 0; x < width; x++) {
        final double xc = x + 0.5;
        final double w = g * xc + h * yc + 1.0;
        if (w == 0.0) {
          continue;
        }
        final double xin = (a * xc + b * yc + c) / w;
        final double yin = (d * xc + e * yc + f) / w;
        if (xin < 0 || yin < 0 || xin >= srcWidth || yin >= srcHeight) {
          continue;
        }
        target.setRGB(x, y, sample(pixels, srcWidth, srcHeight, xin - 0.5, yin - 0.5));
      }
    }
    return target;
  }

  private int sample(final int[] pixels, final int width, final int height, final double x, final double y) {
    final int x0 = (int) Math.floor(x);
    final int y0 = (int) Math.floor(y);
    final double[] wx = weights(x - x0);
    final double[] wy = weights(y - y0);
    double red = 0;
    double green = 0;
    double blue = 0;
    for (int j = 0; j < 4; j++) {
      final int sy = clamp(y0 - 1 + j, height);
      for (int i = 0; i < 4; i++) {
        final int sx = clamp(x0 - 1 + i, width);
        final int rgb = pixels[sy * width + sx];
        final double weight = wx[i] * wy[j];
        red += weight * ((rgb >> 16) & 0xff);
        green += weight * ((rgb >> 8) & 0xff);
        blue += weight * (rgb & 0xff);
      }
    }
    return (channel(red) << 16) | (channel(green) << 8) | channel(blue);
  }

  private static double[] weights(final double t) {
    return new double[]{kernel(t + 1), kernel(t), kernel(1 - t), kernel(2 - t)};
  }

  private static double kernel(final double distance) {
    final double x = Math.abs(distance);
    if (x < 1) {
      return ((CUBIC_A + 2) * x - (CUBIC_A + 3)) * x * x + 1;
    }
    if (x < 2) {
      return (((x - 5) * x + 8) * x - 4) * CUBIC_A;
    }
    return 0;
  }

  private static int clamp(final int value, final int size) {
    return Math.max(0, Math.min(size - 1, value));
  }

  private static int channel(final double value) {
    return (int) Math.max(0, Math.min(255, Math.round(value)));
  }
}
