package com.familycalendar.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle for one-shot commands.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CalendarCommand calendarCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(CalendarCommand calendarCommand, IFactory factory) {
        this.calendarCommand = calendarCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // Serve mode belongs to the embedded web server and the supervisor; picocli's
        // execute() would return at once and tell main() the run is over.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(calendarCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
