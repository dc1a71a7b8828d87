package com.szntopology.cli;

import com.szntopology.core.TopologyException;
import com.szntopology.core.config.ConfigLoader;
import com.szntopology.core.injection.TopologySource;
import com.szntopology.core.model.Topology;
import com.szntopology.core.parser.SznSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check that topology files parse.
 *
 * <p>Every file is parsed and reported on its own line. The exit code is 1
 * if any file fails.
 */
@Command(
    name = "validate",
    description = "Validate SZN files and Python test module topologies",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", description = "Files to validate")
    private List<Path> files;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: szntopology.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    @Override
    public Integer call() {
        TopologySource source = TopologySource.fromConfig(ConfigLoader.load(configPath));
        PrintWriter out = spec.commandLine().getOut();

        int failures = 0;
        for (Path file : files) {
            try {
                Topology topology = source.load(file);
                out.printf("✓ %s: %d nodes, %d ports, %d links%n", file,
                    topology.nodes().size(), topology.ports().size(), topology.links().size());
            } catch (SznSyntaxException e) {
                failures++;
                out.printf("✗ %s: line %d: %s%n", file, e.lineNumber(), e.detail());
            } catch (IOException | TopologyException e) {
                failures++;
                out.printf("✗ %s: %s%n", file, e.getMessage());
            }
        }

        log.info("Validated {} files, {} failed", files.size(), failures);
        out.flush();
        return failures > 0 ? 1 : 0;
    }
}
