package pixinsight.ext.pipeline.model;

/**
 * An image window open in the engine, as reported by {@code list_open_images}.
 *
 * @param id       engine handle (main view id)
 * @param filePath file the window was loaded from, null for generated images
 * @param width    width in pixels
 * @param height   height in pixels
 * @param channels number of channels
 * @param color    true for RGB images
 */
public record ImageInfo(String id, String filePath, int width, int height, int channels, boolean color) {
}
