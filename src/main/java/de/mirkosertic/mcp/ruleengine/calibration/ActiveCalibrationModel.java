package de.mirkosertic.mcp.ruleengine.calibration;

import java.util.concurrent.atomic.AtomicReference;

/**
 * The one calibration model currently used to answer calibration requests.
 * <p>
 * Readers take a plain volatile read; the training orchestrator is the only writer and replaces
 * the model with a single atomic swap.
 */
public class ActiveCalibrationModel {

    private final AtomicReference<CalibrationModel> model;

    public ActiveCalibrationModel() {
        this(CalibrationModel.identity());
    }

    public ActiveCalibrationModel(final CalibrationModel initial) {
        this.model = new AtomicReference<>(initial);
    }

    /**
     * Start from the persisted model, or identity when nothing has been deployed yet.
     */
    public static ActiveCalibrationModel initialize(final CalibrationModelRepository repository) {
        return new ActiveCalibrationModel(repository.load().orElseGet(CalibrationModel::identity));
    }

    public CalibrationModel get() {
        return model.get();
    }

    /**
     * @return the model that was active before
     */
    public CalibrationModel swap(final CalibrationModel next) {
        return model.getAndSet(next);
    }
}
