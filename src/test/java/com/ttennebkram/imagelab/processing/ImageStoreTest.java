package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.errors.DecodeException;
import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.errors.NoImageLoadedException;
import com.ttennebkram.imagelab.errors.UnknownOperationException;
import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.export.Exporter;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.model.SourceInfo;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationCatalog;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.OperationSpec;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ImageStoreTest {

    private static OperationDispatcher dispatcher;

    private ImageStore store;
    private ImageBuffer image;

    @BeforeAll
    public static void setUpDispatcher() {
        dispatcher = new OperationDispatcher(OperationCatalog.createDefault());
    }

    @BeforeEach
    public void setUp() {
        store = new ImageStore(dispatcher);
        image = TestImages.gradient(24, 16);
    }

    private OperationSpec op(Category category, String name) {
        return dispatcher.getCatalog().lookup(category, name);
    }

    @Test
    public void testStartsEmpty() {
        assertEquals(ImageStore.State.EMPTY, store.getState());
        assertEquals(ChainMode.APPLY_TO_ORIGINAL, store.getChainMode());
        assertNull(store.getCurrent());
        assertThrows(NoImageLoadedException.class,
                () -> store.applyOperation(op(Category.FILTER, "Mean"), Map.of()));
        assertEquals(ImageStore.State.EMPTY, store.getState());
    }

    @Test
    public void testLoadApplyReset() {
        store.load(image);
        assertEquals(ImageStore.State.LOADED, store.getState());
        assertSame(image, store.getCurrent());

        ImageBuffer result = store.applyOperation(op(Category.FILTER, "Gaussian"), Map.of("kernelSize", 5));
        assertEquals(ImageStore.State.PROCESSED, store.getState());
        assertSame(result, store.getProcessed());
        assertSame(image, store.getOriginal());
        assertEquals("Gaussian", store.getLastAppliedOperation().getSpec().getName());

        store.reset();
        assertEquals(ImageStore.State.LOADED, store.getState());
        assertNull(store.getProcessed());
        assertNull(store.getLastAppliedOperation());
        assertTrue(store.getHistory().isEmpty());
        assertSame(image, store.getOriginal());
    }

    @Test
    public void testApplyToOriginalDoesNotChain() {
        store.load(image);
        OperationSpec not = op(Category.BITWISE, "NOT");
        store.applyOperation(not, Map.of());
        ImageBuffer second = store.applyOperation(not, Map.of());

        // Both runs start from the original, so the result is the inverted original
        assertEquals(dispatcher.apply(not, Map.of(), image), second);
        assertEquals(1, store.getHistory().size());
    }

    @Test
    public void testApplyToProcessedChains() {
        store.setChainMode(ChainMode.APPLY_TO_PROCESSED);
        store.load(image);
        OperationSpec not = op(Category.BITWISE, "NOT");
        store.applyOperation(not, Map.of());
        ImageBuffer twice = store.applyOperation(not, Map.of());

        assertEquals(image, twice);
        assertEquals(2, store.getHistory().size());
    }

    @Test
    public void testUnknownOperationKeepsState() {
        store.load(image);
        ImageBuffer processed = store.applyOperation("Filter", "Gaussian", Map.of());

        assertThrows(UnknownOperationException.class,
                () -> store.applyOperation("Filter", "NonexistentOp", Map.of()));
        assertSame(processed, store.getProcessed());
        assertEquals(ImageStore.State.PROCESSED, store.getState());
        assertEquals(1, store.getHistory().size());
    }

    @Test
    public void testBadParameterKeepsState() {
        store.load(image);
        ImageBuffer processed = store.applyOperation(op(Category.FILTER, "Median"), Map.of());

        assertThrows(InvalidParameterException.class,
                () -> store.applyOperation(op(Category.FILTER, "Gaussian"), Map.of("sigma", "abc")));
        assertSame(processed, store.getProcessed());
        assertEquals("Median", store.getLastAppliedOperation().getSpec().getName());
    }

    @Test
    public void testBadBytesKeepState() {
        store.load(image);
        assertThrows(DecodeException.class, () -> store.load(new byte[] {1, 2, 3, 4, 5}));
        assertThrows(DecodeException.class, () -> store.load(new byte[0]));
        assertSame(image, store.getOriginal());
        assertEquals(ImageStore.State.LOADED, store.getState());
    }

    @Test
    public void testLoadEncodedBytes() {
        Exporter exporter = new Exporter();
        byte[] png = exporter.encode(image, ExportFormat.PNG, null).getBytes();

        store.load(png, SourceInfo.forFile("gradient.png", png.length));
        assertEquals(image, store.getOriginal());
        assertEquals("PNG", store.getSourceInfo().getFormatLabel());
        assertEquals(png.length, store.getSourceInfo().getByteLength());

        byte[] grayPng = exporter.encode(TestImages.grayGradient(8, 8), ExportFormat.PNG, null).getBytes();
        store.load(grayPng);
        assertEquals(PixelFormat.GRAY8, store.getOriginal().getPixelFormat());
        assertEquals(grayPng.length, store.getSourceInfo().getByteLength());
    }

    @Test
    public void testLoadClearsProcessed() {
        store.load(image);
        store.applyOperation(op(Category.BITWISE, "NOT"), Map.of());
        ImageBuffer other = TestImages.noise(5, 5, PixelFormat.RGB8, 1);
        store.load(other);
        assertEquals(ImageStore.State.LOADED, store.getState());
        assertSame(other, store.getCurrent());
        assertTrue(store.getHistory().isEmpty());
    }

    @Test
    public void testClearKeepsChainMode() {
        store.setChainMode(ChainMode.APPLY_TO_PROCESSED);
        store.load(image);
        store.loadSecondOperand(image);
        store.applyOperation(op(Category.BITWISE, "AND"), Map.of());
        store.clear();
        assertEquals(ImageStore.State.EMPTY, store.getState());
        assertNull(store.getSecondOperand());
        assertNull(store.getSourceInfo());
        assertEquals(ChainMode.APPLY_TO_PROCESSED, store.getChainMode());
    }

    @Test
    public void testDualInputUsesSecondOperand() {
        store.load(image);
        assertThrows(NoImageLoadedException.class,
                () -> store.applyOperation(op(Category.BITWISE, "XOR"), Map.of()));
        assertEquals(ImageStore.State.LOADED, store.getState());

        store.loadSecondOperand(image);
        ImageBuffer xor = store.applyOperation(op(Category.BITWISE, "XOR"), Map.of());
        for (byte b : xor.getData()) {
            assertEquals(0, b);
        }
    }

    @Test
    public void testChainedBitwiseAfterColorConversion() {
        store.setChainMode(ChainMode.APPLY_TO_PROCESSED);
        store.load(TestImages.gradient(10, 10));
        store.loadSecondOperand(TestImages.noise(5, 5, PixelFormat.RGB8, 3));

        store.applyOperation(op(Category.COLOR, "RGB to BGR"), Map.of());
        ImageBuffer and = store.applyOperation(op(Category.BITWISE, "AND"), Map.of());
        assertEquals(10, and.getWidth());
        assertEquals(10, and.getHeight());
        assertEquals(PixelFormat.BGR8, and.getPixelFormat());

        store.applyOperation(op(Category.COLOR, "BGR to RGB"), Map.of());
        store.applyOperation(op(Category.COLOR, "RGB to HSV"), Map.of());
        ImageBuffer xor = store.applyOperation(op(Category.BITWISE, "XOR"), Map.of());
        assertEquals(PixelFormat.HSV8, xor.getPixelFormat());
        assertEquals(5, store.getHistory().size());
    }

    @Test
    public void testReplay() {
        store.load(image);
        OperationSpec gray = op(Category.COLOR, "RGB to Grayscale");
        OperationSpec canny = op(Category.EDGE, "Canny");
        List<AppliedOperation> steps = List.of(
                new AppliedOperation(gray, OperationParams.defaults(gray)),
                new AppliedOperation(canny, OperationParams.resolve(canny, Map.of("threshold1", 50))));

        ImageBuffer replayed = store.replay(steps);
        assertEquals(steps, store.getHistory());
        assertEquals(steps.get(1), store.getLastAppliedOperation());
        assertEquals(dispatcher.apply(canny, Map.of("threshold1", 50), dispatcher.apply(gray, Map.of(), image)),
                replayed);

        store.replay(List.of());
        assertEquals(ImageStore.State.LOADED, store.getState());
    }

    @Test
    public void testModeSwitchAppliesFromNextOperation() {
        store.load(image);
        OperationSpec brightness = op(Category.ENHANCEMENT, "Brightness");
        ImageBuffer first = store.applyOperation(brightness, Map.of("offset", 10));
        store.setChainMode(ChainMode.APPLY_TO_PROCESSED);
        assertSame(first, store.getProcessed());

        ImageBuffer second = store.applyOperation(brightness, Map.of("offset", 10));
        assertNotEquals(first, second);
        assertEquals(2, store.getHistory().size());
    }
}
