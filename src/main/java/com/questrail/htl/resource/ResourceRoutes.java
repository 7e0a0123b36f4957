package com.questrail.htl.resource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * ResourceRoutes
 * =============================================================================
 * Maps URL paths to the files found under a list of directories.
 *
 * <p>Every regular file below a directory is routed at its path relative to
 * that directory, with forward slashes and a leading {@code /}:
 * {@code static/css/site.css} becomes {@code /css/site.css}. When several
 * directories contain the same relative path, the later directory wins.</p>
 *
 * <p>In dev mode each route reloads its file per request. Otherwise each file
 * is loaded once here, and a file that fails to load aborts construction.</p>
 *
 * <p>{@link #withIndex(String)} makes the index page answer {@code /} and every
 * path that matches no file.</p>
 */
public final class ResourceRoutes {
    private final Map<String, ResourceHandler> routes;
    private final ResourceHandler fallback;

    private ResourceRoutes(Map<String, ResourceHandler> routes, ResourceHandler fallback) {
        this.routes = Collections.unmodifiableMap(routes);
        this.fallback = fallback;
    }

    public static ResourceRoutes fromDirectories(List<Path> directories, boolean dev, ResourceLoader loader)
            throws IOException {
        Objects.requireNonNull(directories, "directories");
        Objects.requireNonNull(loader, "loader");

        Map<String, ResourceHandler> routes = new LinkedHashMap<>();
        for (Path directory : directories) {
            final List<Path> files;
            try (Stream<Path> walk = Files.walk(directory)) {
                files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
            }
            for (Path file : files) {
                String route = routeOf(directory, file);
                ResourceHandler handler = dev
                        ? new ReloadingResourceHandler(file, loader)
                        : new CachedResourceHandler(file, loader);
                routes.put(route, handler);
            }
        }
        return new ResourceRoutes(routes, null);
    }

    /**
     * Adds {@code alias} (typically {@code /}) for the handler of {@code route},
     * if that route exists.
     *
     * @return routes including the alias, or this instance if {@code route}
     *         is unknown
     */
    public ResourceRoutes withAlias(String alias, String route) {
        ResourceHandler handler = routes.get(route);
        if (handler == null) {
            return this;
        }
        Map<String, ResourceHandler> copy = new LinkedHashMap<>(routes);
        copy.put(alias, handler);
        return new ResourceRoutes(copy, fallback);
    }

    /**
     * Routes {@code /} to the handler of {@code index} and uses that handler
     * for every unmatched path.
     *
     * @return routes with the index installed, or this instance if
     *         {@code index} is unknown
     */
    public ResourceRoutes withIndex(String index) {
        ResourceRoutes aliased = withAlias("/", index);
        if (aliased == this) {
            return this;
        }
        return new ResourceRoutes(aliased.routes, aliased.routes.get("/"));
    }

    /**
     * @return the handler routed at {@code path}, else the index fallback if
     *         one is installed
     */
    public Optional<ResourceHandler> lookup(String path) {
        ResourceHandler handler = routes.get(path);
        return Optional.ofNullable(handler != null ? handler : fallback);
    }

    public Map<String, ResourceHandler> asMap() {
        return routes;
    }

    static String routeOf(Path directory, Path file) {
        StringBuilder route = new StringBuilder();
        Iterator<Path> names = directory.relativize(file).iterator();
        while (names.hasNext()) {
            route.append('/').append(names.next());
        }
        return route.toString();
    }
}
