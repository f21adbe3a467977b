package org.jkconfig.cli.commands;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.config.KconfigSettings;
import org.jkconfig.tools.ConfigGenerators;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
    name = "alldefconfig",
    description = "Write a configuration with every symbol at its default value"
)
public class AllDefConfigCommand extends AbstractKconfigCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "KCONFIG", description = "Top-level Kconfig file")
    private String kconfigFile;

    @Option(names = {"-o", "--output"}, paramLabel = "OUT", description = "Output file (default: jkconfig.config-file)")
    private String outputFile;

    @Override
    protected Integer run(KconfigSettings settings) throws KconfigException {
        Kconfig kconfig = parseKconfig(kconfigFile, settings);
        ConfigGenerators.loadAllconfig(kconfig, "alldef.config");
        write(kconfig, outputFile, settings);
        return 0;
    }
}
