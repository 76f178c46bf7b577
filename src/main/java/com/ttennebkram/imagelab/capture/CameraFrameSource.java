package com.ttennebkram.imagelab.capture;

import com.ttennebkram.imagelab.config.ImageLabConfig;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.processing.MatConverter;
import com.ttennebkram.imagelab.processing.OpenCvLoader;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.opencv.videoio.VideoCapture;
import org.opencv.videoio.Videoio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Frames from a local camera through OpenCV's VideoCapture, delivered as RGB8.
 */
public class CameraFrameSource implements FrameSource {

    private static final Logger logger = LoggerFactory.getLogger(CameraFrameSource.class);

    private final VideoCapture videoCapture;
    private final int cameraIndex;
    private final boolean mirrorHorizontal;

    private CameraFrameSource(VideoCapture videoCapture, int cameraIndex, boolean mirrorHorizontal) {
        this.videoCapture = videoCapture;
        this.cameraIndex = cameraIndex;
        this.mirrorHorizontal = mirrorHorizontal;
    }

    /**
     * Open the configured camera.
     *
     * @throws IOException if the camera cannot be opened
     */
    public static CameraFrameSource open(ImageLabConfig.Camera camera) throws IOException {
        OpenCvLoader.ensureLoaded();
        VideoCapture capture = new VideoCapture(camera.getIndex());
        if (!capture.isOpened()) {
            capture.release();
            throw new IOException("Failed to open camera at index " + camera.getIndex());
        }
        capture.set(Videoio.CAP_PROP_FRAME_WIDTH, camera.getWidth());
        capture.set(Videoio.CAP_PROP_FRAME_HEIGHT, camera.getHeight());
        logger.info("Camera {} opened at {}x{}", camera.getIndex(), camera.getWidth(), camera.getHeight());
        return new CameraFrameSource(capture, camera.getIndex(), camera.isMirror());
    }

    @Override
    public ImageBuffer nextFrame() {
        Mat frame = new Mat();
        try {
            if (!videoCapture.read(frame) || frame.empty()) {
                return null;
            }
            if (mirrorHorizontal) {
                Core.flip(frame, frame, 1);
            }
            Mat rgb = new Mat();
            Imgproc.cvtColor(frame, rgb, Imgproc.COLOR_BGR2RGB);
            try {
                return MatConverter.toBuffer(rgb, PixelFormat.RGB8);
            } finally {
                rgb.release();
            }
        } finally {
            frame.release();
        }
    }

    @Override
    public void close() {
        videoCapture.release();
        logger.info("Camera {} released", cameraIndex);
    }
}
