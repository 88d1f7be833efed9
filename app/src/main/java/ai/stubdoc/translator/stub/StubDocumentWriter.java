package ai.stubdoc.translator.stub;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads stub sources and writes translated stubs to a file or a stream.
 */
public class StubDocumentWriter {

    public String read(Path source) {
        if (source == null) {
            throw new IllegalArgumentException("source must be provided");
        }
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read stub file: " + source, ex);
        }
    }

    public void write(Path target, String text) {
        if (target == null || text == null) {
            throw new IllegalArgumentException("target and text must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write translated stub: " + target, ex);
        }
    }

    public void write(PrintStream out, String text) {
        if (out == null || text == null) {
            throw new IllegalArgumentException("out and text must be provided");
        }
        out.print(text);
        if (!text.endsWith("\n")) {
            out.println();
        }
        out.flush();
    }
}
