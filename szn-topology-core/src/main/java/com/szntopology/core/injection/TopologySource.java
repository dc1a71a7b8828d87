package com.szntopology.core.injection;

import com.szntopology.core.TopologyException;
import com.szntopology.core.config.SznTopologyConfig;
import com.szntopology.core.model.Topology;
import com.szntopology.core.parser.TopologyParser;
import com.szntopology.core.python.PythonConstantExtractor;
import com.szntopology.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads the topology described by a file.
 *
 * <p>Python test modules ({@code .py}) hold the topology in a module-level
 * string constant, read with {@link PythonConstantExtractor}. Any other file
 * is taken to be plain SZN text.
 */
public class TopologySource {

    private static final Logger log = LoggerFactory.getLogger(TopologySource.class);

    private final TopologyParser parser;
    private final PythonConstantExtractor extractor;

    public TopologySource() {
        this(new TopologyParser(), new PythonConstantExtractor());
    }

    public TopologySource(TopologyParser parser, PythonConstantExtractor extractor) {
        this.parser = parser;
        this.extractor = extractor;
    }

    /**
     * Creates a source using the configured parser and topology variable.
     */
    public static TopologySource fromConfig(SznTopologyConfig config) {
        return new TopologySource(
            new TopologyParser(config.getEffectiveParser().isWarnOnRepeatedKeys()),
            new PythonConstantExtractor(config.getEffectiveInjection().getEffectiveTopologyVariable()));
    }

    /**
     * Returns the SZN text of a file.
     *
     * @param file Python test module or SZN file
     * @return topology text, empty if a Python module has no topology constant
     * @throws IOException if the file cannot be read
     */
    public Optional<String> readText(Path file) throws IOException {
        if ("py".equals(FileUtils.getExtension(file))) {
            return extractor.extract(file);
        }
        return Optional.of(FileUtils.readString(file).strip());
    }

    /**
     * Loads and parses the topology of a file.
     *
     * @param file Python test module or SZN file
     * @return parsed topology
     * @throws IOException if the file cannot be read
     * @throws TopologyException if the file has no topology or it does not parse
     */
    public Topology load(Path file) throws IOException {
        String text = readText(file).orElseThrow(() -> new TopologyException(
            extractor.variable() + " variable could not be found in file " + file));
        return parser.parse(text);
    }

    /**
     * Loads a topology, logging instead of failing.
     *
     * @param file Python test module or SZN file
     * @return parsed topology, or empty if it could not be loaded
     */
    public Optional<Topology> tryLoad(Path file) {
        try {
            return Optional.of(load(file));
        } catch (IOException e) {
            log.error("Unable to read topology file {}: {}", file, e.getMessage());
        } catch (TopologyException e) {
            log.warn("Skipping topology file {}: {}", file, e.getMessage());
        }
        return Optional.empty();
    }
}
