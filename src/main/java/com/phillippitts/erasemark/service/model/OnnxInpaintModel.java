package com.phillippitts.erasemark.service.model;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.phillippitts.erasemark.config.inpaint.LocalModelConfig;
import com.phillippitts.erasemark.exception.InpaintException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.FloatBuffer;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * LaMa-style inpainting model served by ONNX Runtime.
 *
 * <p>Inputs are matched by name: an input whose name contains "mask" receives the
 * {@code [1, 1, S, S]} mask tensor, every other input the {@code [1, 3, S, S]} image tensor.
 * The first output is read as float RGB in [0, 255].
 */
@Component
public class OnnxInpaintModel extends AbstractInpaintModel {

    private static final Logger LOG = LogManager.getLogger(OnnxInpaintModel.class);

    public static final String NAME = "lama-onnx";

    private final LocalModelConfig config;

    // @GuardedBy("lock") for writes; read by concurrent inference
    private volatile OrtEnvironment env;
    private volatile OrtSession session;
    private volatile Set<String> inputNames = Set.of();

    public OnnxInpaintModel(LocalModelConfig config) {
        super(config.inputSize());
        this.config = config;
    }

    @Override
    public String getModelName() {
        return NAME;
    }

    @Override
    protected void doLoad(Path modelPath) throws OrtException {
        OrtEnvironment environment = OrtEnvironment.getEnvironment();
        try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
            options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
            if (config.intraOpThreads() > 0) {
                options.setIntraOpNumThreads(config.intraOpThreads());
            }
            if (config.useGpu()) {
                try {
                    options.addCUDA();
                    LOG.info("CUDA execution provider enabled");
                } catch (OrtException e) {
                    LOG.warn("CUDA execution provider unavailable, using CPU: {}", e.getMessage());
                }
            }
            OrtSession created = environment.createSession(modelPath.toString(), options);
            Set<String> names = created.getInputNames();
            if (names.stream().noneMatch(OnnxInpaintModel::isMaskInput)) {
                created.close();
                throw new IllegalStateException("Model has no mask input, inputs=" + names);
            }
            this.env = environment;
            this.session = created;
            this.inputNames = Set.copyOf(names);
            LOG.debug("ONNX inputs={}, outputs={}", names, created.getOutputNames());
        }
    }

    @Override
    protected float[] doInfer(float[] imageChw, float[] maskChw) throws OrtException {
        OrtSession current = session;
        if (current == null) {
            throw new InpaintException("Session closed during inference", NAME);
        }
        long s = inputSize();
        try (OnnxTensor image = OnnxTensor.createTensor(env, FloatBuffer.wrap(imageChw), new long[]{1, 3, s, s});
             OnnxTensor mask = OnnxTensor.createTensor(env, FloatBuffer.wrap(maskChw), new long[]{1, 1, s, s})) {
            Map<String, OnnxTensor> feeds = new HashMap<>();
            for (String name : inputNames) {
                feeds.put(name, isMaskInput(name) ? mask : image);
            }
            try (OrtSession.Result result = current.run(feeds)) {
                OnnxValue first = result.get(0);
                if (!(first instanceof OnnxTensor tensor)) {
                    throw new InpaintException("Unexpected output type: " + first.getClass().getSimpleName(), NAME);
                }
                FloatBuffer buffer = tensor.getFloatBuffer();
                if (buffer == null) {
                    throw new InpaintException("Output tensor is not float: " + tensor.getInfo(), NAME);
                }
                float[] out = new float[buffer.remaining()];
                buffer.get(out);
                return out;
            }
        }
    }

    @Override
    protected void doClose() {
        OrtSession current = session;
        session = null;
        inputNames = Set.of();
        if (current != null) {
            try {
                current.close();
                LOG.info("ONNX session closed");
            } catch (OrtException e) {
                LOG.warn("Failed to close ONNX session cleanly: {}", e.getMessage());
            }
        }
    }

    static boolean isMaskInput(String inputName) {
        return inputName.toLowerCase(Locale.ROOT).contains("mask");
    }
}
