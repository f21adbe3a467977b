package org.jkconfig.cli.commands;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.config.KconfigSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
    name = "defconfig",
    description = "Load a defconfig file and write the full configuration it implies"
)
public class DefConfigCommand extends AbstractKconfigCommand {

    @Parameters(index = "0", paramLabel = "FILE", description = "The defconfig file to load")
    private String defconfigFile;

    @Parameters(index = "1", arity = "0..1", paramLabel = "KCONFIG", description = "Top-level Kconfig file")
    private String kconfigFile;

    @Option(names = {"-o", "--output"}, paramLabel = "OUT", description = "Output file (default: jkconfig.config-file)")
    private String outputFile;

    @Override
    protected Integer run(KconfigSettings settings) throws KconfigException {
        Kconfig kconfig = parseKconfig(kconfigFile, settings);
        kconfig.loadConfig(defconfigFile);
        write(kconfig, outputFile, settings);
        return 0;
    }
}
