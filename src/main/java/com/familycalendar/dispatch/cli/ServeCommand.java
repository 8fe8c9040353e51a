package com.familycalendar.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: calendar-server serve
 * <p>
 * Starts the web server, the live-update websocket and the background tasks. The web server is
 * enabled by {@link com.familycalendar.CalendarServerApplication#main} seeing "serve" in the
 * arguments, and {@link CliRunner} skips picocli in that mode, so {@link #run()} is only reached
 * through {@code --help} style invocations.
 * <p>
 * Configure the bind address via {@code CALENDAR_NETWORK_INTERFACE_ADDRESS=0.0.0.0} or
 * {@code --calendar.network.port=9090}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the calendar server (default when no command is given)")
@Component
public class ServeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.info("Run without arguments, or with 'serve', to start the server.");
    }
}
