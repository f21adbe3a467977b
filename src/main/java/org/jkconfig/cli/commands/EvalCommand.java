package org.jkconfig.cli.commands;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.config.KconfigSettings;
import org.jkconfig.model.Tristate;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
    name = "eval",
    description = "Evaluate an expression against the configuration and print n, m or y"
)
public class EvalCommand extends AbstractKconfigCommand {

    @Parameters(index = "0", paramLabel = "EXPR", description = "Expression, e.g. \"FOO && !BAR\"")
    private String expression;

    @Parameters(index = "1", arity = "0..1", paramLabel = "KCONFIG", description = "Top-level Kconfig file")
    private String kconfigFile;

    @Option(names = "--load", paramLabel = "FILE", description = "Configuration file to load before evaluating")
    private String configFile;

    @Override
    protected Integer run(KconfigSettings settings) throws KconfigException {
        Kconfig kconfig = parseKconfig(kconfigFile, settings);
        if (configFile != null) {
            kconfig.loadConfig(configFile);
        }
        out().println(Tristate.toString(kconfig.evalString(expression)));
        out().flush();
        return 0;
    }
}
