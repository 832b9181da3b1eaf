package com.playgrounds.apptool;

import com.playgrounds.apptool.cli.AppInfoCommand;
import com.playgrounds.apptool.cli.InfoPlistCommand;
import com.playgrounds.apptool.cli.OrientationCommand;
import com.playgrounds.apptool.cli.PlatformCommand;
import com.playgrounds.apptool.cli.ResourcesCommand;
import com.playgrounds.apptool.cli.SwiftVersionCommand;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(name = "apptool", mixinStandardHelpOptions = true, version = "apptool 1.0.0",
         description = "Edit the Package.swift of a Swift Playground app without reformatting it",
         subcommands = {PlatformCommand.class, SwiftVersionCommand.class, ResourcesCommand.class,
                        InfoPlistCommand.class, OrientationCommand.class, AppInfoCommand.class})
public class AppTool {
    private static final Logger APP_LOGGER = Logger.getLogger("com.playgrounds.apptool");

    @Option(names = {"-v", "--verbose"}, description = "Log what is parsed, matched and written to stderr")
    void setVerbose(boolean verbose) {
        configureLogging(verbose ? Level.FINE : Level.WARNING);
    }

    public static void main(String[] args) {
        configureLogging(Level.WARNING);
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * The command line with defaults read from {@code ~/.apptool.properties} when that file
     * exists.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new AppTool());
        commandLine.setDefaultValueProvider(new CommandLine.PropertiesDefaultProvider());
        return commandLine;
    }

    static void configureLogging(Level level) {
        APP_LOGGER.setLevel(level);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            if (handler instanceof ConsoleHandler && handler.getLevel().intValue() > level.intValue()) {
                handler.setLevel(level);
            }
        }
    }
}
