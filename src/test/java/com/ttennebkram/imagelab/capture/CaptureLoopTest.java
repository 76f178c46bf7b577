package com.ttennebkram.imagelab.capture;

import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CaptureLoopTest {

    /**
     * Delivers a fixed number of frames, or frames forever when the limit is negative.
     */
    private static class FakeSource implements FrameSource {
        private final int limit;
        private final AtomicInteger delivered = new AtomicInteger();
        private volatile boolean closed;

        FakeSource(int limit) {
            this.limit = limit;
        }

        @Override
        public ImageBuffer nextFrame() {
            if (limit >= 0 && delivered.get() >= limit) {
                return null;
            }
            int n = delivered.incrementAndGet();
            return ImageBuffer.filled(2, 2, PixelFormat.GRAY8, n % 256);
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    public void testRunsUntilSourceIsExhausted() {
        FakeSource source = new FakeSource(3);
        List<ImageBuffer> frames = new ArrayList<>();
        CaptureLoop loop = new CaptureLoop(source, frames::add, 0);

        loop.run();
        assertEquals(3, frames.size());
        assertEquals(3, loop.getFrameCount());
        assertEquals(2, frames.get(1).getValue(0, 0, 0));
        assertTrue(source.closed);
        assertFalse(loop.isRunning());
    }

    @Test
    public void testStopRequestedFromCallback() {
        FakeSource source = new FakeSource(-1);
        AtomicInteger seen = new AtomicInteger();
        CaptureLoop[] holder = new CaptureLoop[1];
        holder[0] = new CaptureLoop(source, frame -> {
            if (seen.incrementAndGet() == 2) {
                holder[0].requestStop();
            }
        }, 0);

        holder[0].run();
        assertEquals(2, seen.get());
        assertTrue(source.closed);
    }

    @Test
    public void testCallbackFailureClosesSource() {
        FakeSource source = new FakeSource(-1);
        CaptureLoop loop = new CaptureLoop(source, frame -> {
            throw new IllegalStateException("display gone");
        }, 0);

        assertThrows(IllegalStateException.class, loop::run);
        assertTrue(source.closed);
        assertFalse(loop.isRunning());
    }

    @Test
    public void testStartAndStop() throws InterruptedException {
        FakeSource source = new FakeSource(-1);
        CaptureLoop loop = new CaptureLoop(source, frame -> { }, 200);
        loop.start();

        long deadline = System.currentTimeMillis() + 5000;
        while (loop.getFrameCount() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(loop.getFrameCount() > 0);
        assertTrue(loop.stop(5000));
        assertTrue(source.closed);
        assertThrows(IllegalStateException.class, loop::start);
    }
}
