package com.questrail.htl.cli;

import com.questrail.htl.codec.HtlParseException;
import com.questrail.htl.codec.HtlParser;
import com.questrail.htl.codec.HtlRenderer;
import com.questrail.htl.codec.impl.DefaultHtlParser;
import com.questrail.htl.codec.impl.DefaultHtlRenderer;
import com.questrail.htl.model.HtlElement;

import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Compiles one HTL document to HTML.
 *
 * <p>Reads standard input (or {@code --file}), prints the HTML to standard
 * output, or the parse error to standard error with exit code 1.</p>
 */
@CommandLine.Command(name = "htl", description = "Compile HTL read from stdin to HTML", version = "1.0.0", mixinStandardHelpOptions = true)
public class HtlCommand implements Callable<Integer> {
    @CommandLine.Option(names = {"-f", "--file"}, description = "Read the document from this file instead of stdin")
    private Path file;

    private final HtlParser parser = new DefaultHtlParser();
    private final HtlRenderer renderer = DefaultHtlRenderer.INSTANCE;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HtlCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        final String source;
        try {
            source = read();
        } catch (NoSuchFileException e) {
            System.err.println("Error: file not found: " + file);
            return 1;
        }

        final Optional<HtlElement> tree;
        try {
            tree = parser.parse(source);
        } catch (HtlParseException e) {
            System.err.println(e.getMessage());
            return 1;
        }

        System.out.println(renderer.render(tree.orElse(null)));
        return 0;
    }

    private String read() throws IOException {
        if (file != null) {
            return Files.readString(file, StandardCharsets.UTF_8);
        }
        InputStream in = System.in;
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
