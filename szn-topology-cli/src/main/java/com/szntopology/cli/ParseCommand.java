package com.szntopology.cli;

import com.szntopology.core.TopologyException;
import com.szntopology.core.assembler.TopologyMerger;
import com.szntopology.core.config.ConfigLoader;
import com.szntopology.core.config.SznTopologyConfig;
import com.szntopology.core.injection.InjectionResolver;
import com.szntopology.core.injection.TopologySource;
import com.szntopology.core.json.TopologyJson;
import com.szntopology.core.model.FileInjection;
import com.szntopology.core.model.InjectionResult;
import com.szntopology.core.model.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to parse a topology file and print it as JSON.
 *
 * <p>With {@code --inject}, the attribute injection file is resolved first
 * and the attributes it targets at this file are merged into the output.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * szn-topology parse topology.szn
 * szn-topology parse test/test_ping.py --inject attributes.json --search-path test
 * }</pre>
 */
@Command(
    name = "parse",
    description = "Parse a topology file and print it as JSON",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "SZN file or Python test module")
    private Path file;

    @Option(names = {"-i", "--inject"}, description = "Attribute injection file to apply")
    private Path injectionFile;

    @Option(names = {"-s", "--search-path"}, description = "Search path for relative injection patterns (repeatable)")
    private List<Path> searchPaths = new ArrayList<>();

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: szntopology.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    @Override
    public Integer call() {
        SznTopologyConfig config = ConfigLoader.load(configPath);
        try {
            Topology topology = TopologySource.fromConfig(config).load(file);

            if (injectionFile != null) {
                List<Path> paths = searchPaths.isEmpty()
                    ? config.getEffectiveInjection().getEffectiveSearchPaths()
                    : searchPaths;
                InjectionResult result = InjectionResolver.fromConfig(config).resolve(injectionFile, paths);
                FileInjection injection = result.forFile(file).orElseGet(() -> {
                    log.info("No injected attributes target {}", file);
                    return FileInjection.empty();
                });
                topology = new TopologyMerger().merge(topology, injection);
            }

            spec.commandLine().getOut().println(new TopologyJson().write(topology));
            return 0;
        } catch (IOException | TopologyException e) {
            log.debug("Parse of {} failed", file, e);
            spec.commandLine().getErr().println("✗ Parse failed: " + e.getMessage());
            return 1;
        }
    }
}
