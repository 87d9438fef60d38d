package com.phillippitts.erasemark.service.tile;

import com.phillippitts.erasemark.exception.InpaintException;
import com.phillippitts.erasemark.service.model.InpaintModel;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one tile through the neural model.
 *
 * <p>Tiles smaller than the model input are padded on the right and bottom: the image by
 * reflection without repeating the edge pixel, the mask with zeros. Pixels are fed as RGB
 * channel-first floats in [0, 1] and the mask as {0, 1}. The output is clipped to [0, 255],
 * rounded, cropped back to the tile and returned as BGR.
 */
@Component
public class TileProcessor {

    private static final double MASK_THRESHOLD = 127;

    /**
     * Infers {@code tile} and returns the repainted crop with the tile's dimensions.
     *
     * @throws InpaintException if the model fails or returns malformed output
     */
    public Mat process(Tile tile, InpaintModel model) {
        InferenceResult result = infer(tile, model);
        return toImage(result);
    }

    InferenceResult infer(Tile tile, InpaintModel model) {
        int size = model.inputSize();
        int w = tile.spec().width();
        int h = tile.spec().height();
        if (w > size || h > size) {
            throw new IllegalArgumentException("Tile " + w + "x" + h + " exceeds model input " + size);
        }

        float[] image = imageTensor(tile.image(), size);
        float[] mask = maskTensor(tile.mask(), size);
        float[] output;
        try {
            output = model.infer(image, mask);
        } catch (InpaintException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InpaintException("Inference failed for tile " + tile.spec() + ": " + e.getMessage(),
                    model.getModelName(), e);
        }
        try {
            return new InferenceResult(output, size, w, h);
        } catch (IllegalArgumentException e) {
            throw new InpaintException("Malformed model output: " + e.getMessage(), model.getModelName(), e);
        }
    }

    float[] imageTensor(Mat bgrCrop, int size) {
        Mat padded = padTo(bgrCrop, size, Core.BORDER_REFLECT_101);
        Mat rgb = new Mat();
        Imgproc.cvtColor(padded, rgb, Imgproc.COLOR_BGR2RGB);
        Mat normalized = new Mat();
        rgb.convertTo(normalized, CvType.CV_32FC3, 1.0 / 255.0);

        List<Mat> planes = new ArrayList<>(3);
        Core.split(normalized, planes);
        int plane = size * size;
        float[] chw = new float[3 * plane];
        float[] buffer = new float[plane];
        for (int c = 0; c < 3; c++) {
            planes.get(c).get(0, 0, buffer);
            System.arraycopy(buffer, 0, chw, c * plane, plane);
            planes.get(c).release();
        }
        padded.release();
        rgb.release();
        normalized.release();
        return chw;
    }

    float[] maskTensor(Mat maskCrop, int size) {
        Mat padded = padTo(maskCrop, size, Core.BORDER_CONSTANT);
        Mat binary = new Mat();
        Imgproc.threshold(padded, binary, MASK_THRESHOLD, 1, Imgproc.THRESH_BINARY);
        Mat asFloat = new Mat();
        binary.convertTo(asFloat, CvType.CV_32FC1);
        float[] values = new float[size * size];
        asFloat.get(0, 0, values);
        padded.release();
        binary.release();
        asFloat.release();
        return values;
    }

    Mat toImage(InferenceResult result) {
        int size = result.tensorSize();
        int plane = size * size;
        List<Mat> planes = new ArrayList<>(3);
        for (int c = 0; c < 3; c++) {
            Mat channel = new Mat(size, size, CvType.CV_32FC1);
            float[] values = new float[plane];
            System.arraycopy(result.chw(), c * plane, values, 0, plane);
            channel.put(0, 0, values);
            planes.add(channel);
        }
        Mat rgbFloat = new Mat();
        Core.merge(planes, rgbFloat);
        planes.forEach(Mat::release);

        // convertTo saturates to [0, 255] and rounds to nearest
        Mat rgb = new Mat();
        rgbFloat.submat(new Rect(0, 0, result.cropWidth(), result.cropHeight())).convertTo(rgb, CvType.CV_8UC3);
        rgbFloat.release();

        Mat bgr = new Mat();
        Imgproc.cvtColor(rgb, bgr, Imgproc.COLOR_RGB2BGR);
        rgb.release();
        return bgr;
    }

    private static Mat padTo(Mat crop, int size, int borderType) {
        int bottom = size - crop.rows();
        int right = size - crop.cols();
        if (bottom == 0 && right == 0) {
            return crop.clone();
        }
        Mat padded = new Mat();
        Core.copyMakeBorder(crop, padded, 0, bottom, 0, right, borderType, Scalar.all(0));
        return padded;
    }
}
