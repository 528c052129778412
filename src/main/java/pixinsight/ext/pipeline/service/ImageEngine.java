package pixinsight.ext.pipeline.service;

import pixinsight.ext.pipeline.model.ImageInfo;
import pixinsight.ext.pipeline.model.ImageStatistics;
import pixinsight.ext.pipeline.stretch.PixelTransform;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Typed operations on the external image engine.
 *
 * <p>Images are addressed by handle (the engine's view id). Handles live in a single
 * namespace shared by everything open in the engine, and an engine may rename an image
 * when it is saved or opened, so every operation that can produce a handle returns the
 * one actually in use.</p>
 *
 * <p>All failures are {@link IOException}s: transport problems, timeouts and engine-side
 * error results alike.</p>
 */
public interface ImageEngine {

    List<ImageInfo> listImages() throws IOException;

    /**
     * Opens a file. Some formats open several windows (e.g. an XISF with a crop mask).
     *
     * @return every window opened, the main image first
     */
    List<ImageInfo> openImage(Path file) throws IOException;

    /**
     * Saves an image, overwriting any existing file.
     *
     * @return the handle of the image after the save
     */
    String saveImage(String handle, Path file) throws IOException;

    void closeImage(String handle) throws IOException;

    /**
     * @return the id the engine assigned, which may differ if {@code newId} was taken
     */
    String renameImage(String handle, String newId) throws IOException;

    /**
     * Duplicates an image into a new window.
     *
     * @return the handle of the copy
     */
    String cloneImage(String handle, String newId) throws IOException;

    ImageStatistics statistics(String handle) throws IOException;

    /**
     * Luminance medians of five square regions: the four corners followed by the centre.
     *
     * @param boxFraction side of each box relative to the shorter image dimension
     */
    double[] regionMedians(String handle, double boxFraction) throws IOException;

    /**
     * Applies a pixel transform in place.
     */
    void applyTransform(String handle, PixelTransform transform) throws IOException;

    /**
     * Evaluates PixelMath expressions in place. One expression is applied to every
     * channel; three are applied to R, G and B respectively. Expressions may reference
     * other open images by handle.
     */
    void pixelMath(String handle, List<String> expressions, boolean truncate) throws IOException;

    /**
     * Creates a new image from PixelMath expressions: one expression gives a grey image,
     * three give an RGB image.
     *
     * @param geometryReference handle of the image whose width and height the new image takes
     * @return handle of the new image
     */
    String createImage(String newId, List<String> expressions, String geometryReference) throws IOException;

    /**
     * Runs a process on an image.
     *
     * @return handles of images the process created (e.g. a star image or a background model)
     */
    List<String> runProcess(String handle, ProcessCall call) throws IOException;

    /**
     * Drops the undo history of an image to release engine memory.
     */
    void purgeHistory(String handle) throws IOException;
}
