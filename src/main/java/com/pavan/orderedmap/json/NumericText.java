package com.pavan.orderedmap.json;

import java.util.regex.Pattern;

/**
 * Recognizes strings that spell a JSON number.
 */
final class NumericText {
    
    private static final Pattern INTEGER = Pattern.compile("-?(0|[1-9][0-9]*)");
    private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9][0-9]*)(\\.[0-9]+)?([eE][+-]?[0-9]+)?");
    
    private NumericText() {
    }
    
    /**
     * Parses the text as a {@code Long} if it is an integer in range, otherwise as a
     * finite {@code Double}.
     *
     * @param text candidate text
     * @return the number, or null if the text is not a JSON number or does not fit a double
     */
    static Number parse(String text) {
        if (!NUMBER.matcher(text).matches()) {
            return null;
        }
        if (INTEGER.matcher(text).matches()) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                // Out of long range, fall through to double
            }
        }
        double value = Double.parseDouble(text);
        return Double.isInfinite(value) ? null : value;
    }
}
