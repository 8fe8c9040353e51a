package com.familycalendar.core.lifecycle;

import com.familycalendar.core.config.CalendarProperties;
import com.familycalendar.core.state.AppState;
import com.familycalendar.core.tasks.TaskBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.concurrent.CountDownLatch;

/**
 * Long-lived task standing for the embedded web server. It stays running for as long as the
 * server serves and completes when {@link #stop()} is called on shutdown.
 */
@Component
public class WebServerTask implements TaskBody<AppState> {

    private static final Logger log = LoggerFactory.getLogger(WebServerTask.class);

    private final CalendarProperties properties;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public WebServerTask(CalendarProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(AppState state) throws InterruptedException {
        log.debug("Web server task running");
        stopped.await();
        log.info("Web server stopped");
    }

    @Override
    public String name() {
        return "web-server";
    }

    public void stop() {
        stopped.countDown();
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String configured = properties.getNetwork().getInterfaceAddress();
        try {
            InetAddress address = InetAddress.getByName(configured);
            log.info(ListenAddress.describe(address, port));
            log.info("Full listen address: {}", ListenAddress.url(address, port));
        } catch (UnknownHostException e) {
            log.info("Web server listening on {}:{}", configured, port);
        }
    }
}
