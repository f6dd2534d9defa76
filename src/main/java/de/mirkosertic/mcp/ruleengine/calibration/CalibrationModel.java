package de.mirkosertic.mcp.ruleengine.calibration;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fitted calibration model: method tag plus its parameter list.
 *
 * @param method      calibration method
 * @param parameters  method-specific parameters, see the method's {@link CalibrationFunction}
 * @param ece         expected calibration error on the validation split at fit time
 * @param brier       Brier score on the validation split at fit time
 * @param sampleCount number of samples the model was fitted and validated on
 * @param trainedAt   fit time, null for the identity model
 */
public record CalibrationModel(
        CalibrationMethod method,
        List<Double> parameters,
        double ece,
        double brier,
        int sampleCount,
        @Nullable Instant trainedAt
) {

    public CalibrationModel {
        parameters = List.copyOf(parameters);
    }

    public static CalibrationModel identity() {
        return new CalibrationModel(CalibrationMethod.IDENTITY, List.of(), Double.NaN, Double.NaN, 0, null);
    }

    public boolean isIdentity() {
        return method == CalibrationMethod.IDENTITY;
    }

    public CalibrationModel withMetrics(final double ece, final double brier) {
        return new CalibrationModel(method, parameters, ece, brier, sampleCount, trainedAt);
    }

    public Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("method", method.name());
        map.put("parameters", new ArrayList<>(parameters));
        map.put("ece", ece);
        map.put("brier", brier);
        map.put("sample-count", sampleCount);
        if (trainedAt != null) {
            map.put("trained-at", trainedAt.toString());
        }
        return map;
    }

    @SuppressWarnings("unchecked")
    public static CalibrationModel fromMap(final Map<String, Object> map) {
        final CalibrationMethod method = CalibrationMethod.valueOf(String.valueOf(map.get("method")));
        final List<Double> parameters = new ArrayList<>();
        final Object rawParameters = map.get("parameters");
        if (rawParameters != null) {
            for (final Object value : (List<Object>) rawParameters) {
                parameters.add(((Number) value).doubleValue());
            }
        }
        final Object trainedAt = map.get("trained-at");
        return new CalibrationModel(
                method,
                parameters,
                toDouble(map.get("ece")),
                toDouble(map.get("brier")),
                map.get("sample-count") instanceof Number n ? n.intValue() : 0,
                trainedAt != null ? Instant.parse(trainedAt.toString()) : null
        );
    }

    private static double toDouble(final @Nullable Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            return Double.parseDouble(value.toString());
        }
        return Double.NaN;
    }
}
