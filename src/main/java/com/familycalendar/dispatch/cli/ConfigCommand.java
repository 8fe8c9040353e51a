package com.familycalendar.dispatch.cli;

import com.familycalendar.core.config.CalendarProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import picocli.CommandLine.Command;

/**
 * CLI command: calendar-server config
 * <p>
 * Prints the effective {@code calendar.*} configuration as JSON, after every property source
 * Spring Boot consults has been applied.
 */
@Command(name = "config", mixinStandardHelpOptions = true,
        description = "Print the effective configuration as JSON")
@Component
public class ConfigCommand implements Runnable {

    private final CalendarProperties properties;
    private final ObjectMapper objectMapper;

    public ConfigCommand(CalendarProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        try {
            System.out.println(render());
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Could not render configuration: " + e.getOriginalMessage());
        }
    }

    String render() throws JsonProcessingException {
        return objectMapper.copy()
                .registerModule(new SimpleModule().addSerializer(DataSize.class, ToStringSerializer.instance))
                .enable(SerializationFeature.INDENT_OUTPUT)
                .writeValueAsString(properties);
    }
}
