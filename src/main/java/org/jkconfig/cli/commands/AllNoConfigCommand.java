package org.jkconfig.cli.commands;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.config.KconfigSettings;
import org.jkconfig.model.ConfigItem;
import org.jkconfig.tools.ConfigGenerators;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Set;

@Command(
    name = "allnoconfig",
    description = "Write a configuration with as many symbols as possible set to n"
)
public class AllNoConfigCommand extends AbstractKconfigCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "KCONFIG", description = "Top-level Kconfig file")
    private String kconfigFile;

    @Option(names = {"-o", "--output"}, paramLabel = "OUT", description = "Output file (default: jkconfig.config-file)")
    private String outputFile;

    @Option(names = "--simple", description = "Assign each symbol once instead of lowering to a fixed point")
    private boolean simple;

    @Override
    protected Integer run(KconfigSettings settings) throws KconfigException {
        Kconfig kconfig = parseKconfig(kconfigFile, settings);
        Set<ConfigItem> keep = ConfigGenerators.loadAllconfig(kconfig, "allno.config");
        if (simple) {
            ConfigGenerators.allnoconfigSimple(kconfig, keep);
        } else {
            ConfigGenerators.allnoconfig(kconfig, keep);
        }
        write(kconfig, outputFile, settings);
        return 0;
    }
}
