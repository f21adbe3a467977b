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
    name = "allyesconfig",
    description = "Write a configuration with as many symbols as possible set to y"
)
public class AllYesConfigCommand extends AbstractKconfigCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "KCONFIG", description = "Top-level Kconfig file")
    private String kconfigFile;

    @Option(names = {"-o", "--output"}, paramLabel = "OUT", description = "Output file (default: jkconfig.config-file)")
    private String outputFile;

    @Override
    protected Integer run(KconfigSettings settings) throws KconfigException {
        Kconfig kconfig = parseKconfig(kconfigFile, settings);
        Set<ConfigItem> keep = ConfigGenerators.loadAllconfig(kconfig, "allyes.config");
        ConfigGenerators.allyesconfig(kconfig, keep);
        write(kconfig, outputFile, settings);
        return 0;
    }
}
