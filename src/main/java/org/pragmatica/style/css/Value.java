package org.pragmatica.style.css;

/**
 * Declared property value.
 */
public sealed interface Value {

    /**
     * Render the value back to stylesheet text.
     */
    String toCss();

    static Value keyword(String text) {
        return new Keyword(text);
    }

    static Value size(double number, Unit unit) {
        return new Size(number, unit);
    }

    static Value color(int r, int g, int b) {
        return new Color(r, g, b);
    }

    /**
     * Anything that is neither a size nor a color, kept verbatim.
     */
    record Keyword(String text) implements Value {
        @Override
        public String toCss() {
            return text;
        }
    }

    record Size(double number, Unit unit) implements Value {
        @Override
        public String toCss() {
            var text = number == Math.rint(number) && Math.abs(number) < 1e15
                       ? Long.toString((long) number)
                       : Double.toString(number);
            return text + unit.suffix();
        }
    }

    /**
     * RGB color; each channel is 0..255.
     */
    record Color(int r, int g, int b) implements Value {
        public Color {
            checkChannel("r", r);
            checkChannel("g", g);
            checkChannel("b", b);
        }

        private static void checkChannel(String name, int value) {
            if (value < 0 || value > 255) {
                throw new IllegalArgumentException("Color channel " + name + " out of range: " + value);
            }
        }

        @Override
        public String toCss() {
            return String.format("#%02x%02x%02x", r, g, b);
        }
    }
}
