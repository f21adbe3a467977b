package org.jkconfig.cli.commands;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.cli.CommandLineInterface;
import org.jkconfig.config.KconfigSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Base class of the subcommands. Loads the settings from the parent command, parses the
 * Kconfig tree and maps a {@link KconfigException} to exit code 1.
 */
public abstract class AbstractKconfigCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractKconfigCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public final Integer call() {
        try {
            return run(parent.getSettings());
        } catch (KconfigException e) {
            LOG.debug("Command '{}' failed", spec.name(), e);
            err().println("Error: " + e.getMessage());
            err().flush();
            return 1;
        }
    }

    /**
     * Runs the command.
     *
     * @param settings The resolved tool settings.
     * @return The exit code.
     * @throws KconfigException if parsing, loading or writing fails.
     */
    protected abstract Integer run(KconfigSettings settings) throws KconfigException;

    /**
     * Parses the Kconfig tree.
     *
     * @param kconfigFile The top-level file, or {@code null} for the configured default.
     * @param settings The tool settings.
     * @return The parsed configuration.
     * @throws KconfigException if the files cannot be read or contain syntax errors.
     */
    protected Kconfig parseKconfig(String kconfigFile, KconfigSettings settings) throws KconfigException {
        return Kconfig.builder()
                .filename(kconfigFile != null ? kconfigFile : settings.kconfigFile())
                .environment(parent.getEnvironment())
                .settings(settings)
                .build();
    }

    /**
     * Writes the configuration and reports the file on standard output.
     */
    protected void write(Kconfig kconfig, String outputFile, KconfigSettings settings) throws KconfigException {
        String target = outputFile != null ? outputFile : settings.configFile();
        kconfig.writeConfig(target);
        out().println("Configuration written to " + target);
        out().flush();
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    protected CommandLineInterface getParent() {
        return parent;
    }
}
