package com.phillippitts.erasemark.service.codec;

import com.phillippitts.erasemark.exception.EraseMarkException;
import com.phillippitts.erasemark.exception.InvalidImageException;
import com.phillippitts.erasemark.util.OpenCvLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Decodes request payloads into OpenCV rasters and encodes results as PNG.
 *
 * <p>Images are always decoded to 8-bit BGR. Masks are decoded to 8-bit single channel:
 * color and color+alpha masks are reduced to luminance and 16-bit masks are rescaled.
 * Anything else is rejected with {@link InvalidImageException} before a backend runs.
 */
@Component
public class ImageCodec {

    /** Upper bound on accepted payloads (64 MB). */
    public static final int MAX_PAYLOAD_BYTES = 64 * 1024 * 1024;

    private static final double SIXTEEN_TO_EIGHT_BIT = 1.0 / 257.0;

    public ImageCodec() {
        OpenCvLoader.ensureLoaded();
    }

    /**
     * Decodes an encoded image (PNG, JPEG, WebP, ...) into a BGR raster.
     *
     * @throws InvalidImageException when the payload is empty, too large or undecodable
     */
    public Mat decodeImage(byte[] data) {
        requirePayload(data, "Image");
        Mat decoded = Imgcodecs.imdecode(new MatOfByte(data), Imgcodecs.IMREAD_COLOR);
        if (decoded.empty()) {
            throw new InvalidImageException(data.length, "Image bytes could not be decoded");
        }
        return decoded;
    }

    /**
     * Decodes an encoded mask into a {@code CV_8UC1} raster.
     *
     * @throws InvalidImageException when the payload is undecodable or has an unsupported layout
     */
    public Mat decodeMask(byte[] data) {
        requirePayload(data, "Mask");
        Mat raw = Imgcodecs.imdecode(new MatOfByte(data), Imgcodecs.IMREAD_UNCHANGED);
        if (raw.empty()) {
            throw new InvalidImageException(data.length, "Mask bytes could not be decoded");
        }

        Mat gray;
        switch (raw.channels()) {
            case 1 -> gray = raw;
            case 3 -> {
                gray = new Mat();
                Imgproc.cvtColor(raw, gray, Imgproc.COLOR_BGR2GRAY);
            }
            case 4 -> {
                gray = new Mat();
                Imgproc.cvtColor(raw, gray, Imgproc.COLOR_BGRA2GRAY);
            }
            default -> throw new InvalidImageException(data.length,
                    "Unsupported mask channel count: " + raw.channels());
        }

        int depth = CvType.depth(gray.type());
        if (depth == CvType.CV_8U) {
            return gray;
        }
        if (depth == CvType.CV_16U) {
            Mat eight = new Mat();
            gray.convertTo(eight, CvType.CV_8U, SIXTEEN_TO_EIGHT_BIT);
            return eight;
        }
        throw new InvalidImageException(data.length, "Unsupported mask depth: " + CvType.typeToString(gray.type()));
    }

    /**
     * Encodes a raster as PNG.
     *
     * @throws EraseMarkException if the encoder rejects the raster
     */
    public byte[] encodePng(Mat image) {
        MatOfByte buffer = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(".png", image, buffer)) {
                throw new EraseMarkException("PNG encoding failed for raster " + image);
            }
            return buffer.toArray();
        } finally {
            buffer.release();
        }
    }

    /**
     * Converts a raster to an AWT image for libraries that consume {@link BufferedImage}.
     */
    public BufferedImage toBufferedImage(Mat image) {
        byte[] png = encodePng(image);
        try {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(png));
            if (decoded == null) {
                throw new EraseMarkException("No ImageIO reader for PNG");
            }
            return decoded;
        } catch (IOException e) {
            throw new EraseMarkException("Failed to convert raster to BufferedImage", e);
        }
    }

    private void requirePayload(byte[] data, String what) {
        if (data == null || data.length == 0) {
            throw new InvalidImageException(what + " payload is empty");
        }
        if (data.length > MAX_PAYLOAD_BYTES) {
            throw new InvalidImageException(data.length, what + " payload too large: " + data.length
                    + " bytes. Max: " + MAX_PAYLOAD_BYTES + " bytes");
        }
    }
}
