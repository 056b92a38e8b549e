package com.vision_assistant_service.audio;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vision_assistant_service.alert.Alert;
import com.vision_assistant_service.alert.AlertAggregator;

/**
 * Single consumer of the alert stream.
 *
 * <p>Utterances are serialised through a fair lock, so an immediate response from
 * {@link #speakNow(String)} waits for the current utterance and then goes ahead of the
 * next queued alert. Stopping is checked before each utterance; an utterance in progress
 * always finishes.
 */
public class Announcer {

    private static final Logger log = LoggerFactory.getLogger(Announcer.class);

    private final AlertAggregator aggregator;
    private final SpeechSynthesizer synthesizer;
    private final ReentrantLock speechLock = new ReentrantLock(true);
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final AtomicLong utterances = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile Thread worker;

    public Announcer(AlertAggregator aggregator, SpeechSynthesizer synthesizer) {
        this.aggregator = aggregator;
        this.synthesizer = synthesizer;
    }

    public void start() {
        if (stopped.get() || !running.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::drain, "announcer");
        thread.setDaemon(true);
        worker = thread;
        thread.start();
        log.info("Announcer started");
    }

    /**
     * Speaks outside the alert queue, ahead of anything not yet started.
     *
     * @return false if the announcer was stopped or the engine failed
     */
    public boolean speakNow(String text) {
        if (stopped.get()) {
            return false;
        }
        return speak(text);
    }

    /**
     * Stops after the current utterance. Waiting for the next alert is interrupted by
     * closing the aggregator, not the speaking thread.
     */
    public void stop(Duration wait) {
        stopped.set(true);
        running.set(false);
        aggregator.close();
        Thread thread = worker;
        if (thread == null) {
            return;
        }
        try {
            thread.join(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Announcer still speaking after {} ms", wait.toMillis());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getUtterances() {
        return utterances.get();
    }

    public long getFailures() {
        return failures.get();
    }

    private void drain() {
        while (running.get()) {
            Alert alert;
            try {
                alert = aggregator.next();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (alert == null || !running.get()) {
                break;
            }
            speak(alert.message());
        }
        running.set(false);
        log.info("Announcer stopped");
    }

    private boolean speak(String text) {
        speechLock.lock();
        try {
            synthesizer.speak(text);
            utterances.incrementAndGet();
            return true;
        } catch (SpeechException e) {
            failures.incrementAndGet();
            log.warn("Could not speak '{}': {}", text, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.warn("Speech engine failed on '{}'", text, e);
            return false;
        } finally {
            speechLock.unlock();
        }
    }
}
