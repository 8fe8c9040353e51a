package com.familycalendar.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level command. Routes to {@code serve}, {@code config} and {@code help}.
 */
@Command(
        name = "calendar-server",
        mixinStandardHelpOptions = true,
        version = "calendar-server 0.1.0",
        description = "Self-hosted family calendar server",
        subcommands = {
                ServeCommand.class,
                ConfigCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CalendarCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
