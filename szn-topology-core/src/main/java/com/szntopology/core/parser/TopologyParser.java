package com.szntopology.core.parser;

import com.szntopology.core.assembler.TopologyAssembler;
import com.szntopology.core.model.Topology;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parses SZN text into a {@link Topology}.
 *
 * <p>The text is tokenized and parsed by the generated ANTLR grammar, turned
 * into {@link Statement}s and then assembled. Any lexer or parser error aborts
 * the whole parse with a {@link SznSyntaxException}; a second environment
 * block aborts it with a {@link SznSemanticException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Topology topology = new TopologyParser().parse("""
 *     [type=switch] sw1 sw2
 *     [rate=fast] sw1:1 -- sw2:1
 *     """);
 * }</pre>
 *
 * <p>Instances hold no parse state and can be shared between threads.
 */
public class TopologyParser {

    private static final Logger log = LoggerFactory.getLogger(TopologyParser.class);

    private final boolean warnOnRepeatedKeys;
    private final TopologyAssembler assembler = new TopologyAssembler();

    public TopologyParser() {
        this(true);
    }

    /**
     * @param warnOnRepeatedKeys log a warning when a key appears twice in one attribute block
     */
    public TopologyParser(boolean warnOnRepeatedKeys) {
        this.warnOnRepeatedKeys = warnOnRepeatedKeys;
    }

    /**
     * Parses and assembles a topology.
     *
     * @param text SZN source
     * @return the assembled topology
     * @throws SznSyntaxException if the text is malformed
     * @throws SznSemanticException if the environment is declared twice
     */
    public Topology parse(String text) {
        Topology topology = assembler.assemble(parseStatements(text));
        log.debug("Parsed topology with {} nodes, {} ports and {} links",
            topology.nodes().size(), topology.ports().size(), topology.links().size());
        return topology;
    }

    /**
     * Parses the text into its statements without assembling them.
     *
     * @param text SZN source
     * @return statements in source order
     * @throws SznSyntaxException if the text is malformed
     */
    public List<Statement> parseStatements(String text) {
        SourceLines lines = new SourceLines(text);
        ThrowingErrorListener errorListener = new ThrowingErrorListener(lines);

        SznLexer lexer = new SznLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        SznParser parser = new SznParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        try {
            return new StatementCollector(lines, warnOnRepeatedKeys).collect(parser.topology());
        } catch (SznSyntaxException e) {
            log.error(e.getMessage());
            throw e;
        }
    }
}
