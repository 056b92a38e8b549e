package com.vision_assistant_service.config;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.vision_assistant_service.audio.Announcer;
import com.vision_assistant_service.service.PersistenceSink;

import jakarta.annotation.PreDestroy;

/**
 * Opens the session and starts the announcer once the application is up; on shutdown
 * stops announcing, closes the session and drains pending writes.
 */
@Component
public class VisionLifecycle {

    private static final Logger log = LoggerFactory.getLogger(VisionLifecycle.class);

    private final PersistenceSink persistenceSink;
    private final Announcer announcer;
    private final VisionProperties properties;

    public VisionLifecycle(PersistenceSink persistenceSink, Announcer announcer, VisionProperties properties) {
        this.persistenceSink = persistenceSink;
        this.announcer = announcer;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        persistenceSink.startSession().whenComplete((sessionId, error) -> {
            if (error != null) {
                log.warn("Could not open a session at startup: {}", error.toString());
            }
        });
        announcer.start();
    }

    @PreDestroy
    public void stop() {
        long waitMillis = properties.getPersistence().getShutdownWait().toMillis();
        announcer.stop(properties.getPersistence().getShutdownWait());
        try {
            persistenceSink.endSession().get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Could not close the session cleanly: {}", e.toString());
        }
        persistenceSink.shutdown(properties.getPersistence().getShutdownWait());
    }
}
