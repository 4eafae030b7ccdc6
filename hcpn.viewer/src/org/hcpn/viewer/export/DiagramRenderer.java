package org.hcpn.viewer.export;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

import org.apache.log4j.Logger;
import org.hcpn.viewer.RenderStyle;
import org.hcpn.viewer.graph.DeclarativeGraph;

/**
 * Hands a declarative graph to a rendering backend.
 *
 * Formats {@code dot}/{@code gv} and {@code json} are written directly.
 * Any other format ({@code pdf}, {@code png}, {@code svg}, ...) is passed
 * through to the Graphviz executable as {@code -T<format>}; the core does not
 * interpret it. Backend failures propagate as {@link IOException}.
 */
public class DiagramRenderer {
    private static final Logger logger = Logger.getLogger(DiagramRenderer.class);

    private final DotGraphWriter dotWriter = new DotGraphWriter();
    private final JsonGraphWriter jsonWriter = new JsonGraphWriter();
    private final String dotExecutable;

    public DiagramRenderer() {
        this(RenderStyle.fromSystemProperties());
    }

    public DiagramRenderer(RenderStyle style) {
        this.dotExecutable = Objects.requireNonNull(style, "style cannot be null").getDotExecutable();
    }

    /**
     * Render the graph to {@code output} in the given format.
     *
     * @return the written file
     */
    public Path save(DeclarativeGraph graph, Path output, String format) throws IOException {
        Objects.requireNonNull(graph, "graph cannot be null");
        Objects.requireNonNull(output, "output cannot be null");
        String normalized = Objects.requireNonNull(format, "format cannot be null").trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Output format cannot be empty");
        }

        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        switch (normalized) {
            case "dot":
            case "gv":
                Files.write(output, dotWriter.write(graph).getBytes(StandardCharsets.UTF_8));
                break;
            case "json":
                Files.write(output, jsonWriter.write(graph).getBytes(StandardCharsets.UTF_8));
                break;
            default:
                runGraphviz(dotWriter.write(graph), output, normalized);
        }
        logger.info("Diagram " + graph.name + " saved to " + output + " (" + normalized + ")");
        return output;
    }

    /**
     * Render to a temporary file for display and return its path.
     */
    public Path view(DeclarativeGraph graph, String format) throws IOException {
        Path output = Files.createTempFile("hcpn-", "." + format.trim().toLowerCase(Locale.ROOT));
        return save(graph, output, format);
    }

    private void runGraphviz(String dot, Path output, String format) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(dotExecutable, "-T" + format, "-o", output.toString());
        builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        File errors = File.createTempFile("hcpn-dot-", ".err");
        builder.redirectError(errors);

        try {
            Process process = builder.start();
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(dot.getBytes(StandardCharsets.UTF_8));
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IOException(dotExecutable + " exited with code " + exitCode + ": " + readAll(errors));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for " + dotExecutable, e);
        } finally {
            Files.deleteIfExists(errors.toPath());
        }
    }

    private static String readAll(File file) throws IOException {
        return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8).trim();
    }
}
