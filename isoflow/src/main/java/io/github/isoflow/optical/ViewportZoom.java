package io.github.isoflow.optical;

/**
 * Zoom levels are relative to the viewport of the web application, not to the
 * annotation image: zoom 1 is what a user sees by default.
 */
public final class ViewportZoom {

  /**
   * Viewport width in pixels.
   */
  public static final double VIEWPORT_WIDTH = 1000.0;

  /**
   * Viewport height in pixels.
   */
  public static final double VIEWPORT_HEIGHT = 500.0;

  private ViewportZoom() {
  }

  /**
   * Scale factor applied to the annotation image shape for a requested zoom level.
   * Rounded half up, never below 1.
   *
   * @param zoom   the requested zoom level
   * @param width  annotation image width
   * @param height annotation image height
   * @return the effective zoom
   */
  public static int effectiveZoom(final int zoom, final int width, final int height) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("Invalid annotation image shape: " + width + "x" + height);
    }
    final double scale = Math.min(VIEWPORT_WIDTH / width, VIEWPORT_HEIGHT / height);
    return (int) Math.max(1L, Math.round(zoom * scale));
  }
}
