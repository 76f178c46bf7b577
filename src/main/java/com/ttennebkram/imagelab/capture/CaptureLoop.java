package com.ttennebkram.imagelab.capture;

import com.ttennebkram.imagelab.model.ImageBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Pulls frames from a {@link FrameSource} and hands each to a callback until
 * stopped. The stop request is checked once per frame; the loop also ends when
 * its thread is interrupted or the source runs dry. The source is closed on
 * every exit, including when the callback throws.
 *
 * A loop runs once. Create a new one (with a new source) to restart capture.
 */
public class CaptureLoop implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(CaptureLoop.class);

    private final FrameSource source;
    private final Consumer<ImageBuffer> onFrame;
    private final long frameDelayMs;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong frameCount = new AtomicLong();
    private Thread captureThread;

    /**
     * @param fps target frame rate; 0 or less means as fast as the source delivers
     */
    public CaptureLoop(FrameSource source, Consumer<ImageBuffer> onFrame, double fps) {
        this.source = source;
        this.onFrame = onFrame;
        this.frameDelayMs = fps > 0 ? (long) (1000.0 / fps) : 0;
    }

    /**
     * Run on the calling thread until stopped.
     */
    @Override
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Capture loop is already running");
        }
        try (FrameSource frames = source) {
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                long startTime = System.currentTimeMillis();

                ImageBuffer frame = frames.nextFrame();
                if (frame == null) {
                    logger.debug("Frame source exhausted after {} frames", frameCount.get());
                    break;
                }
                frameCount.incrementAndGet();
                onFrame.accept(frame);

                // Maintain frame rate
                long sleepTime = frameDelayMs - (System.currentTimeMillis() - startTime);
                if (sleepTime > 0) {
                    try {
                        Thread.sleep(sleepTime);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        } finally {
            running.set(false);
        }
    }

    /**
     * Run on a daemon thread.
     */
    public synchronized void start() {
        if (captureThread != null) {
            throw new IllegalStateException("Capture loop was already started");
        }
        captureThread = new Thread(() -> {
            try {
                run();
            } catch (RuntimeException e) {
                logger.error("Capture stopped: {}", e.getMessage(), e);
            }
        }, "CaptureLoop");
        captureThread.setDaemon(true);
        captureThread.start();
    }

    /**
     * Ask the loop to stop after the current frame.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    /**
     * Request a stop and wait up to the given time for the loop thread to finish.
     *
     * @return true if the loop is no longer running
     */
    public boolean stop(long timeoutMs) {
        requestStop();
        Thread thread;
        synchronized (this) {
            thread = captureThread;
        }
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(timeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return !running.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getFrameCount() {
        return frameCount.get();
    }
}
