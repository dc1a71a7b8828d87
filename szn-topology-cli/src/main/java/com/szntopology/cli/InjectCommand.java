package com.szntopology.cli;

import com.szntopology.core.TopologyException;
import com.szntopology.core.config.ConfigLoader;
import com.szntopology.core.config.SznTopologyConfig;
import com.szntopology.core.injection.InjectionResolver;
import com.szntopology.core.json.TopologyJson;
import com.szntopology.core.model.InjectionResult;
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
 * Command to resolve an attribute injection file and print the attributes
 * it injects into every matched file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Search the working directory
 * szn-topology inject attributes.json
 *
 * # Search specific directories
 * szn-topology inject attributes.json test/ other/
 * }</pre>
 */
@Command(
    name = "inject",
    description = "Resolve an attribute injection file and print the result as JSON",
    mixinStandardHelpOptions = true
)
public class InjectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InjectCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Attribute injection file (JSON)")
    private Path injectionFile;

    @Parameters(index = "1..*", arity = "0..*", description = "Search paths (default: configured paths or current directory)")
    private List<Path> searchPaths = new ArrayList<>();

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: szntopology.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    @Override
    public Integer call() {
        SznTopologyConfig config = ConfigLoader.load(configPath);
        List<Path> paths = searchPaths.isEmpty()
            ? config.getEffectiveInjection().getEffectiveSearchPaths()
            : searchPaths;

        try {
            log.info("Resolving attribute injection file: {}", injectionFile);
            InjectionResult result = InjectionResolver.fromConfig(config).resolve(injectionFile, paths);
            spec.commandLine().getOut().println(new TopologyJson().write(result));
            return 0;
        } catch (IOException | TopologyException e) {
            log.debug("Injection of {} failed", injectionFile, e);
            spec.commandLine().getErr().println("✗ Injection failed: " + e.getMessage());
            return 1;
        }
    }
}
