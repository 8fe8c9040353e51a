package com.familycalendar.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Calendar server settings bound from {@code calendar.*}.
 * <p>
 * Defaults keep the server local-only: it listens on loopback until told otherwise.
 */
@Component
@ConfigurationProperties(prefix = "calendar")
public class CalendarProperties {

    private Network network = new Network();
    private Logs logs = new Logs();
    private Realtime realtime = new Realtime();
    private Tasks tasks = new Tasks();
    private Supervisor supervisor = new Supervisor();
    private Permissions permissions = new Permissions();

    public Network getNetwork() { return network; }
    public void setNetwork(Network network) { this.network = network; }
    public Logs getLogs() { return logs; }
    public void setLogs(Logs logs) { this.logs = logs; }
    public Realtime getRealtime() { return realtime; }
    public void setRealtime(Realtime realtime) { this.realtime = realtime; }
    public Tasks getTasks() { return tasks; }
    public void setTasks(Tasks tasks) { this.tasks = tasks; }
    public Supervisor getSupervisor() { return supervisor; }
    public void setSupervisor(Supervisor supervisor) { this.supervisor = supervisor; }
    public Permissions getPermissions() { return permissions; }
    public void setPermissions(Permissions permissions) { this.permissions = permissions; }

    public static class Network {
        private String interfaceAddress = "127.0.0.1";
        private int port = 8080;

        public String getInterfaceAddress() { return interfaceAddress; }
        public void setInterfaceAddress(String interfaceAddress) { this.interfaceAddress = interfaceAddress; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
    }

    public static class Logs {
        private String path = "./logs";
        private Duration keepFor = Duration.ofDays(7);

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public Duration getKeepFor() { return keepFor; }
        public void setKeepFor(Duration keepFor) { this.keepFor = keepFor; }
    }

    public static class Realtime {
        private String path = "/ws";
        private int channelCapacity = 1024;
        private Duration sendTimeLimit = Duration.ofSeconds(10);
        private DataSize sendBufferSizeLimit = DataSize.ofKilobytes(512);

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public int getChannelCapacity() { return channelCapacity; }
        public void setChannelCapacity(int channelCapacity) { this.channelCapacity = channelCapacity; }
        public Duration getSendTimeLimit() { return sendTimeLimit; }
        public void setSendTimeLimit(Duration sendTimeLimit) { this.sendTimeLimit = sendTimeLimit; }
        public DataSize getSendBufferSizeLimit() { return sendBufferSizeLimit; }
        public void setSendBufferSizeLimit(DataSize sendBufferSizeLimit) { this.sendBufferSizeLimit = sendBufferSizeLimit; }
    }

    public static class Tasks {
        private Duration reapInterval = Duration.ofSeconds(60);

        public Duration getReapInterval() { return reapInterval; }
        public void setReapInterval(Duration reapInterval) { this.reapInterval = reapInterval; }
    }

    public static class Supervisor {
        private boolean exitOnTaskExit = true;

        public boolean isExitOnTaskExit() { return exitOnTaskExit; }
        public void setExitOnTaskExit(boolean exitOnTaskExit) { this.exitOnTaskExit = exitOnTaskExit; }
    }

    public static class Permissions {
        /** "jdbc" or "memory". */
        private String backend = "jdbc";

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }
    }
}
