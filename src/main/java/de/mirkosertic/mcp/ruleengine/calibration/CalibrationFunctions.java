package de.mirkosertic.mcp.ruleengine.calibration;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatch table from calibration method to its fitting/application function.
 */
final class CalibrationFunctions {

    private static final CalibrationFunction IDENTITY = new CalibrationFunction() {
        @Override
        public List<Double> fit(final double[] scores, final boolean[] labels) {
            return List.of();
        }

        @Override
        public double apply(final List<Double> parameters, final double score, final Double logit) {
            return score;
        }
    };

    private static final Map<CalibrationMethod, CalibrationFunction> TABLE;

    static {
        final Map<CalibrationMethod, CalibrationFunction> table = new EnumMap<>(CalibrationMethod.class);
        table.put(CalibrationMethod.IDENTITY, IDENTITY);
        table.put(CalibrationMethod.TEMPERATURE_SCALING, new TemperatureScaling());
        table.put(CalibrationMethod.PLATT_SCALING, new PlattScaling());
        table.put(CalibrationMethod.ISOTONIC_REGRESSION, new IsotonicRegression());
        TABLE = Collections.unmodifiableMap(table);
    }

    private CalibrationFunctions() {
    }

    /**
     * Fitted methods in {@link CalibrationMethod} order, without the identity.
     */
    static Map<CalibrationMethod, CalibrationFunction> candidates() {
        final Map<CalibrationMethod, CalibrationFunction> candidates = new EnumMap<>(TABLE);
        candidates.remove(CalibrationMethod.IDENTITY);
        return candidates;
    }

    static CalibrationFunction of(final CalibrationMethod method) {
        return TABLE.get(method);
    }
}
