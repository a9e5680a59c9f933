package com.classlayout.core.renderer;

/**
 * Interface for renderers that hand a finished layout to an output destination.
 *
 * <p>Renderers write layout results to different targets: layout JSON files on disk,
 * a console summary, or any downstream drawing back end.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI), see
 * {@link RendererRegistry}, and several can run for the same document.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemRenderer implements LayoutRenderer {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public void render(LayoutDocument document, RenderContext context) {
 *         Path target = Path.of(context.outputDirectory()).resolve(document.name() + ".layout.json");
 *         LayoutJson.write(document.result(), target);
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.classlayout.core.renderer.LayoutRenderer}
 *
 * @see LayoutDocument
 * @see RenderContext
 */
public interface LayoutRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used for referencing the renderer in configuration and on the command line.
     * Should be lowercase (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the layout document to the target destination.
     *
     * <p>Implementations should throw {@link IllegalStateException} when the destination
     * cannot be written.
     *
     * @param document laid-out diagram to render
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if rendering fails
     */
    void render(LayoutDocument document, RenderContext context);
}
