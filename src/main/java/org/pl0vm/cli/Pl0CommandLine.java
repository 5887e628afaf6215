package org.pl0vm.cli;

import com.typesafe.config.Config;
import org.pl0vm.cli.commands.CompileCommand;
import org.pl0vm.cli.commands.RunCommand;
import org.pl0vm.config.ConfigLoader;
import org.pl0vm.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pl0vm",
    mixinStandardHelpOptions = true,
    version = "pl0vm 1.0",
    description = "Compiles PL/0 programs and runs them on the stack virtual machine.",
    subcommands = {
        RunCommand.class,
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class Pl0CommandLine implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: pl0vm.conf in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show the usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new Pl0CommandLine());
        commandLine.setCommandName("pl0vm");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The merged configuration.
     * @throws IllegalArgumentException if {@code --config} names a missing file.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile != null ? configFile.toPath() : null);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
