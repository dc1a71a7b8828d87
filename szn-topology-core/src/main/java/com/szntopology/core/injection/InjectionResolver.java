package com.szntopology.core.injection;

import com.szntopology.core.config.SznTopologyConfig;
import com.szntopology.core.model.Element;
import com.szntopology.core.model.ElementKind;
import com.szntopology.core.model.FileInjection;
import com.szntopology.core.model.InjectionResult;
import com.szntopology.core.model.InjectionRule;
import com.szntopology.core.model.Modifier;
import com.szntopology.core.model.Topology;
import com.szntopology.core.selector.SelectorMatcher;
import com.szntopology.core.util.Attributes;
import com.szntopology.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves an attribute injection specification against the topology files
 * it names.
 *
 * <p>For every rule, the file patterns are expanded over the search paths.
 * Each matched file's topology is loaded once and every modifier's selectors
 * are evaluated against it; the selected elements collect the modifier's
 * attributes under their display key. Later rules and modifiers override
 * earlier ones key by key.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * InjectionResult result = new InjectionResolver()
 *     .resolve(Path.of("attributes.json"), List.of(Path.of("test")));
 * FileInjection injection = result.forFile(Path.of("test/test_ping.py")).orElseThrow();
 * }</pre>
 */
public class InjectionResolver {

    private static final Logger log = LoggerFactory.getLogger(InjectionResolver.class);

    private final InjectionSpecLoader specLoader;
    private final TopologySource topologySource;
    private final SelectorMatcher matcher;
    private final List<String> filePatterns;

    public InjectionResolver() {
        this(new InjectionSpecLoader(), new TopologySource(), SznTopologyConfig.DEFAULT_FILE_PATTERNS);
    }

    /**
     * @param specLoader reader for specification files
     * @param topologySource loader for the matched files' topologies
     * @param filePatterns file name globs a matched file must satisfy
     */
    public InjectionResolver(InjectionSpecLoader specLoader, TopologySource topologySource, List<String> filePatterns) {
        this.specLoader = specLoader;
        this.topologySource = topologySource;
        this.matcher = new SelectorMatcher();
        this.filePatterns = List.copyOf(filePatterns);
    }

    /**
     * Creates a resolver from configuration.
     *
     * @param config loaded configuration
     * @return configured resolver
     */
    public static InjectionResolver fromConfig(SznTopologyConfig config) {
        return new InjectionResolver(
            new InjectionSpecLoader(),
            TopologySource.fromConfig(config),
            config.getEffectiveInjection().getEffectiveFilePatterns());
    }

    /**
     * Loads a specification file and resolves it.
     *
     * @param specFile JSON injection specification
     * @param searchPaths directories for relative file patterns, empty for the working directory
     * @return per-file injections
     * @throws IOException if the specification cannot be read
     * @throws InjectionSpecException if the specification is malformed
     */
    public InjectionResult resolve(Path specFile, List<Path> searchPaths) throws IOException {
        return resolve(specLoader.load(specFile), searchPaths);
    }

    /**
     * Resolves already loaded rules.
     *
     * @param rules injection rules in order
     * @param searchPaths directories for relative file patterns, empty for the working directory
     * @return per-file injections in first-match order
     */
    public InjectionResult resolve(List<InjectionRule> rules, List<Path> searchPaths) {
        List<Path> expandedPaths = expandSearchPaths(searchPaths);
        log.debug("Expanded injection search paths: {}", expandedPaths);

        Map<Path, FileInjectionBuilder> builders = new LinkedHashMap<>();
        Map<Path, Optional<Topology>> topologies = new HashMap<>();

        for (InjectionRule rule : rules) {
            for (Path file : expandFiles(rule.files(), expandedPaths)) {
                FileInjectionBuilder builder = builders.computeIfAbsent(file, key -> new FileInjectionBuilder());
                builder.mergeEnvironment(rule.environment());

                Optional<Topology> topology = topologies.computeIfAbsent(file, topologySource::tryLoad);
                if (topology.isEmpty()) {
                    continue;
                }
                for (Modifier modifier : rule.modifiers()) {
                    apply(modifier, topology.get(), builder);
                }
            }
        }

        Map<Path, FileInjection> files = new LinkedHashMap<>();
        builders.forEach((file, builder) -> files.put(file, builder.build()));
        log.info("Resolved attribute injection for {} files", files.size());
        return new InjectionResult(files);
    }

    private void apply(Modifier modifier, Topology topology, FileInjectionBuilder builder) {
        ElementKind kind = modifier.kind();
        for (Element element : matcher.selectAll(modifier.selectors(), topology, kind)) {
            builder.mergeElement(element.key(), modifier.attributes());
        }
    }

    /**
     * Expands the search paths to themselves plus all their non-hidden
     * subdirectories, made absolute, without duplicates.
     */
    List<Path> expandSearchPaths(List<Path> searchPaths) {
        List<Path> roots = searchPaths == null || searchPaths.isEmpty()
            ? List.of(Path.of(""))
            : searchPaths;

        Set<Path> expanded = new LinkedHashSet<>();
        for (Path root : roots) {
            expanded.add(root.toAbsolutePath().normalize());
        }
        for (Path root : new ArrayList<>(expanded)) {
            expanded.addAll(FileUtils.subdirectories(root));
        }
        return new ArrayList<>(expanded);
    }

    /**
     * Expands file patterns into the matching topology files.
     */
    List<Path> expandFiles(List<String> patterns, List<Path> searchPaths) {
        Set<Path> files = new LinkedHashSet<>();
        for (String pattern : patterns) {
            List<String> absolutePatterns = new ArrayList<>();
            if (Path.of(pattern).isAbsolute()) {
                absolutePatterns.add(pattern);
            } else {
                for (Path searchPath : searchPaths) {
                    absolutePatterns.add(absolutePattern(searchPath, pattern));
                }
            }

            for (String absolutePattern : absolutePatterns) {
                try {
                    for (Path file : FileUtils.findFiles(absolutePattern)) {
                        if (Files.isRegularFile(file) && FileUtils.nameMatchesAny(file, filePatterns)) {
                            files.add(file.toAbsolutePath().normalize());
                        }
                    }
                } catch (IOException e) {
                    log.warn("Unable to expand file pattern {}: {}", absolutePattern, e.getMessage());
                }
            }
        }
        return new ArrayList<>(files);
    }

    /**
     * Joins a search path and a relative file pattern with a single separator.
     */
    static String absolutePattern(Path searchPath, String pattern) {
        String base = searchPath.toString();
        String separator = searchPath.getFileSystem().getSeparator();
        return base.endsWith(separator) ? base + pattern : base + separator + pattern;
    }

    private static final class FileInjectionBuilder {
        private final Map<String, Object> environment = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> elements = new LinkedHashMap<>();

        void mergeEnvironment(Map<String, Object> attributes) {
            Attributes.merge(environment, attributes);
        }

        void mergeElement(String key, Map<String, Object> attributes) {
            Attributes.merge(elements.computeIfAbsent(key, k -> new LinkedHashMap<>()), attributes);
        }

        FileInjection build() {
            return new FileInjection(environment, elements);
        }
    }
}
