package bio.treeio.cli;

import bio.treeio.config.Config;
import bio.treeio.config.ConfigLoader;
import bio.treeio.config.SystemEnvironmentReader;
import bio.treeio.io.NewickTreeReader;
import bio.treeio.io.TreeReadSummary;
import bio.treeio.logging.LoggingConfigurator;
import bio.treeio.writer.NewickWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader, tree reader and writer.
 */
public final class CliApplication {

    static final int EXIT_TREE_FAILURES = 1;
    static final int EXIT_IO_FAILURE = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final InputStream stdin;
    private final PrintStream stdout;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), System.in, System.out);
    }

    CliApplication(ConfigLoader configLoader, InputStream stdin, PrintStream stdout) {
        this.configLoader = configLoader;
        this.stdin = stdin;
        this.stdout = stdout;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.debug("Newick options: {}", config.newickOptions());

        try {
            String text = readInput(config);
            TreeReadSummary summary = new NewickTreeReader(config.newickOptions()).readAll(text);
            String rendered = new NewickWriter(config.newickOptions()).writeAll(summary.trees());
            writeOutput(config, rendered);
            LOGGER.info("Wrote {} tree(s) to {}", summary.trees().size(),
                    config.output().map(Path::toString).orElse("standard output"));
            if (summary.hasFailures()) {
                LOGGER.warn("{} tree(s) could not be read", summary.failures().size());
                return EXIT_TREE_FAILURES;
            }
            return 0;
        } catch (UncheckedIOException ex) {
            LOGGER.error("{}", ex.getMessage(), ex.getCause());
            return EXIT_IO_FAILURE;
        }
    }

    private String readInput(Config config) {
        try {
            if (config.input().isPresent()) {
                return Files.readString(config.input().get(), StandardCharsets.UTF_8);
            }
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read trees from "
                    + config.input().map(Path::toString).orElse("standard input"), ex);
        }
    }

    private void writeOutput(Config config, String rendered) {
        if (config.output().isEmpty()) {
            stdout.print(rendered);
            stdout.flush();
            return;
        }
        Path target = config.output().get();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, rendered, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write trees to " + target, ex);
        }
    }
}
