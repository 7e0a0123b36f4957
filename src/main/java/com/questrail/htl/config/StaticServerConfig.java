package com.questrail.htl.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration for the static server.
 *
 * <p>{@code host} may be {@code null} to bind every interface. Port 0 asks the
 * system for an ephemeral port.</p>
 */
public record StaticServerConfig(
    String host,
    int port,
    boolean dev,
    List<Path> directories,
    String index
) {
    public static final int DEFAULT_PORT = 8000;
    public static final String DEFAULT_INDEX = "/index.htl";

    public StaticServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be 0-65535");
        }
        Objects.requireNonNull(directories, "directories");
        if (directories.isEmpty()) {
            throw new IllegalArgumentException("At least one directory required");
        }
        directories = List.copyOf(directories);
        Objects.requireNonNull(index, "index");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private boolean dev;
        private List<Path> directories = List.of(Paths.get("static"));
        private String index = DEFAULT_INDEX;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withDev(boolean dev) {
            this.dev = dev;
            return this;
        }

        public Builder withDirectories(List<Path> directories) {
            this.directories = directories;
            return this;
        }

        /**
         * Colon-separated directory list, e.g. {@code static:overrides}.
         * Empty segments are ignored.
         */
        public Builder withDirectories(String colonSeparated) {
            Objects.requireNonNull(colonSeparated, "colonSeparated");
            List<Path> dirs = new ArrayList<>();
            for (String dir : colonSeparated.split(":")) {
                if (!dir.isEmpty()) {
                    dirs.add(Paths.get(dir));
                }
            }
            this.directories = dirs;
            return this;
        }

        public Builder withIndex(String index) {
            this.index = index;
            return this;
        }

        public StaticServerConfig build() {
            return new StaticServerConfig(host, port, dev, directories, index);
        }
    }
}
