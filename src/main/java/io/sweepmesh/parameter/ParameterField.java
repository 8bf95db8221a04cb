package io.sweepmesh.parameter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One configurable field of a parameter: its kind, default and accepted range or choices.
 */
public record ParameterField(
        String name,
        String label,
        String description,
        Kind kind,
        Object defaultValue,
        int min,
        int max,
        List<String> choices,
        boolean required
) {
    private static final Pattern TIME = Pattern.compile("^([01]?[0-9]|2[0-3]):[0-5][0-9]$");

    public enum Kind {
        INT,
        CHOICE,
        TIME
    }

    public ParameterField {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static ParameterField intField(String name, String label, String description, int defaultValue, int min, int max) {
        return new ParameterField(name, label, description, Kind.INT, defaultValue, min, max, List.of(), true);
    }

    public static ParameterField choiceField(String name, String label, String description, List<String> choices, String defaultValue) {
        return new ParameterField(name, label, description, Kind.CHOICE, defaultValue, 0, 0, choices, true);
    }

    public static ParameterField timeField(String name, String label, String description, String defaultValue) {
        return new ParameterField(name, label, description, Kind.TIME, defaultValue, 0, 0, List.of(), true);
    }

    public boolean validate(Object value) {
        if (value == null) {
            return false;
        }
        return switch (kind) {
            case INT -> {
                Integer parsed = toInt(value);
                yield parsed != null && parsed >= min && parsed <= max;
            }
            case CHOICE -> choices.contains(String.valueOf(value));
            case TIME -> value instanceof String s && TIME.matcher(s).matches();
        };
    }

    static Integer toInt(Object value) {
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d == Math.rint(d) ? (int) d : null;
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
