package com.classlayout.core.renderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Renderers available on the class path, keyed by id.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RendererRegistry registry = RendererRegistry.load();
 * for (LayoutRenderer renderer : registry.resolve(List.of("filesystem", "console"))) {
 *     renderer.render(document, context);
 * }
 * }</pre>
 */
public final class RendererRegistry {

    private static final Logger log = LoggerFactory.getLogger(RendererRegistry.class);

    private final Map<String, LayoutRenderer> renderers = new LinkedHashMap<>();

    public RendererRegistry(Collection<? extends LayoutRenderer> renderers) {
        for (LayoutRenderer renderer : renderers) {
            if (this.renderers.putIfAbsent(renderer.getId(), renderer) != null) {
                log.warn("Ignoring duplicate renderer id: {}", renderer.getId());
            }
        }
    }

    /**
     * Discovers renderers via {@link ServiceLoader}.
     *
     * @return registry of all registered renderers
     */
    public static RendererRegistry load() {
        log.debug("Discovering layout renderers via ServiceLoader");
        List<LayoutRenderer> found = new ArrayList<>();
        ServiceLoader.load(LayoutRenderer.class).forEach(found::add);
        log.debug("Discovered {} layout renderer(s)", found.size());
        return new RendererRegistry(found);
    }

    public Optional<LayoutRenderer> find(String id) {
        return Optional.ofNullable(renderers.get(id));
    }

    /**
     * Resolves renderer ids in the given order.
     *
     * @param ids renderer ids
     * @return matching renderers
     * @throws IllegalArgumentException if an id is not registered
     */
    public List<LayoutRenderer> resolve(List<String> ids) {
        List<LayoutRenderer> resolved = new ArrayList<>(ids.size());
        for (String id : ids) {
            resolved.add(find(id).orElseThrow(() -> new IllegalArgumentException(
                "Unknown renderer '" + id + "', available: " + renderers.keySet())));
        }
        return resolved;
    }

    public List<String> ids() {
        return List.copyOf(renderers.keySet());
    }
}
