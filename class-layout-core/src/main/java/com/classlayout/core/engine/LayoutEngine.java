package com.classlayout.core.engine;

import com.classlayout.core.layout.LayoutResult;

/**
 * Layout engine for one kind of diagram.
 *
 * <p>An engine turns a parsed diagram model into positioned {@link LayoutResult} elements.
 * Engines are pure: they perform no I/O, keep no state between calls and can be shared
 * between threads.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class ClassLayoutEngine implements LayoutEngine<ClassDiagram> {
 *     @Override
 *     public String getId() {
 *         return "class";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Class Diagram Layout";
 *     }
 *
 *     @Override
 *     public LayoutResult layout(ClassDiagram diagram) {
 *         ...
 *     }
 * }
 * }</pre>
 *
 * @param <T> diagram model type
 */
public interface LayoutEngine<T> {

    /**
     * Returns unique identifier for this engine.
     *
     * <p>Lowercase, e.g. "class".
     *
     * @return engine identifier
     */
    String getId();

    /**
     * Returns human-readable name used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Lays out a diagram.
     *
     * @param diagram diagram model, never null
     * @return positioned elements and overall bounds
     */
    LayoutResult layout(T diagram);
}
