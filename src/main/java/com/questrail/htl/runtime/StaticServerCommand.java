package com.questrail.htl.runtime;

import com.questrail.htl.config.StaticServerConfig;
import com.questrail.htl.observability.Slf4jStaticServerObservabilitySink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Command-line entry point of the static server: serves the files of one or
 * more directories over HTTP, compiling {@code .htl} files to HTML.
 */
@CommandLine.Command(name = "ffe", description = "Serve static resources, compiling .htl files to HTML", version = "1.0.0", mixinStandardHelpOptions = true)
public class StaticServerCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(StaticServerCommand.class);

    @CommandLine.Option(names = {"-p", "--port"}, description = "Port to listen on (default: ${DEFAULT-VALUE})")
    private int port = StaticServerConfig.DEFAULT_PORT;

    @CommandLine.Option(names = "--host", description = "Host name or address to bind; all interfaces when omitted")
    private String host;

    @CommandLine.Option(names = "--dev", description = "Dev mode: reload and recompile files on every request")
    private boolean dev;

    @CommandLine.Option(names = "--dirs", description = "Colon-separated directories containing static resources. Latter directories win when there are duplicate files (default: ${DEFAULT-VALUE})")
    private String dirs = "static";

    @CommandLine.Option(names = "--index", description = "Route also served at / (default: ${DEFAULT-VALUE})")
    private String index = StaticServerConfig.DEFAULT_INDEX;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new StaticServerCommand()).execute(args);
        System.exit(exitCode);
    }

    StaticServerConfig config() {
        return StaticServerConfig.builder()
            .withHost(host)
            .withPort(port)
            .withDev(dev)
            .withDirectories(dirs)
            .withIndex(index)
            .build();
    }

    @Override
    public Integer call() throws Exception {
        StaticServerRuntime runtime = StaticServerRuntime.builder()
            .withConfig(config())
            .withObservabilitySink(new Slf4jStaticServerObservabilitySink())
            .build();

        runtime.start();
        Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "ffe-shutdown"));
        log.info("Listening on {}{}", runtime.localAddress(), dev ? " (dev mode)" : "");

        runtime.awaitTermination();
        return 0;
    }
}
