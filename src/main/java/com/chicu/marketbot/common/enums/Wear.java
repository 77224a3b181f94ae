package com.chicu.marketbot.common.enums;

/**
 * Степень износа скина по float value.
 *
 * Границы: общепринятая шкала CS2, полуоткрытые интервалы [lower, upper):
 * <pre>
 *   Factory New     [0.00, 0.07)
 *   Minimal Wear    [0.07, 0.15)
 *   Field-Tested    [0.15, 0.38)
 *   Well-Worn       [0.38, 0.45)
 *   Battle-Scarred  [0.45, 1.00]
 * </pre>
 * Значение вне [0, 1] или отсутствие float → {@link #UNKNOWN}.
 */
public enum Wear {

    FACTORY_NEW("Factory New", 0.00, 0.07),
    MINIMAL_WEAR("Minimal Wear", 0.07, 0.15),
    FIELD_TESTED("Field-Tested", 0.15, 0.38),
    WELL_WORN("Well-Worn", 0.38, 0.45),
    BATTLE_SCARRED("Battle-Scarred", 0.45, 1.00),
    UNKNOWN("Unknown", Double.NaN, Double.NaN);

    public static final double MIN_FLOAT = 0.0;
    public static final double MAX_FLOAT = 1.0;

    private final String label;
    private final double lower;
    private final double upper;

    Wear(String label, double lower, double upper) {
        this.label = label;
        this.lower = lower;
        this.upper = upper;
    }

    public String label() {
        return label;
    }

    public double lower() {
        return lower;
    }

    public double upper() {
        return upper;
    }

    public static Wear fromFloat(Double floatValue) {
        if (floatValue == null || floatValue.isNaN()) return UNKNOWN;

        double v = floatValue;
        if (v < MIN_FLOAT || v > MAX_FLOAT) return UNKNOWN;

        for (Wear w : values()) {
            if (w == UNKNOWN) continue;
            if (v >= w.lower && v < w.upper) return w;
        }
        // верхняя граница 1.0 включительно
        return BATTLE_SCARRED;
    }

    /**
     * Износ из суффикса названия: "AK-47 | Redline (Field-Tested)".
     */
    public static Wear fromItemName(String itemName) {
        if (itemName == null || itemName.isBlank()) return UNKNOWN;

        for (Wear w : values()) {
            if (w == UNKNOWN) continue;
            if (itemName.contains("(" + w.label + ")")) return w;
        }
        return UNKNOWN;
    }
}
