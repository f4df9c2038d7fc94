package com.stepgraph.core.loader;

import com.stepgraph.core.error.DuplicateEntityException;
import com.stepgraph.core.error.StepParseException;
import com.stepgraph.core.error.StepValidationException;
import com.stepgraph.core.graph.EntityGraph;
import com.stepgraph.core.graph.EntityGraphBuilder;
import com.stepgraph.core.lexer.StepLexer;
import com.stepgraph.core.lexer.Token;
import com.stepgraph.core.lexer.TokenKind;
import com.stepgraph.core.model.StepFile;
import com.stepgraph.core.parser.StepParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reads a STEP/IFC file and runs it through parser and graph builder.
 *
 * <p>Input starting with {@code ISO-10303-21;} is parsed as a complete physical file.
 * Anything else is treated as a bare sequence of instance statements, which is handy
 * for snippets cut out of a larger file.
 *
 * <p>Files are read as UTF-8; malformed bytes are replaced, since conforming files are
 * plain ASCII and anything beyond that only shows up inside string literals.
 */
public class StepModelLoader {

    private static final Logger log = LoggerFactory.getLogger(StepModelLoader.class);

    private static final String ISO_KEYWORD_PREFIX = "ISO-";

    private final EntityGraphBuilder builder;

    public StepModelLoader() {
        this(new EntityGraphBuilder());
    }

    public StepModelLoader(EntityGraphBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
    }

    /**
     * Loads a file from disk.
     *
     * @param path input file
     * @return parsed model
     * @throws IOException if the file cannot be read
     * @throws StepValidationException if the file is malformed or has duplicate instance names
     */
    public StepModel load(Path path) throws IOException, StepValidationException {
        Objects.requireNonNull(path, "path must not be null");
        log.debug("Reading {}", path);
        String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return parse(content, path.toString());
    }

    /**
     * Parses in-memory content.
     *
     * @param content file content
     * @param sourceName label used in log messages and view titles
     * @return parsed model
     * @throws StepParseException if the content is malformed
     * @throws DuplicateEntityException if an instance name is declared twice
     */
    public StepModel parse(String content, String sourceName) throws StepParseException, DuplicateEntityException {
        Objects.requireNonNull(content, "content must not be null");

        long start = System.nanoTime();
        StepParser parser = new StepParser(content);
        StepFile file = hasFileEnvelope(content)
            ? parser.parseFile()
            : new StepFile(List.of(), parser.parseInstances());
        long parsed = System.nanoTime();

        EntityGraph graph = builder.build(file);
        long built = System.nanoTime();

        log.info("Loaded {}: {} entities, {} references, {} dangling",
            sourceName, graph.size(), graph.edges().size(), graph.danglingReferences().size());

        return new StepModel(sourceName, file, graph,
            Duration.ofNanos(parsed - start), Duration.ofNanos(built - parsed));
    }

    static boolean hasFileEnvelope(String content) {
        Token first = new StepLexer(content).next();
        return first.is(TokenKind.KEYWORD) && first.text().startsWith(ISO_KEYWORD_PREFIX);
    }
}
