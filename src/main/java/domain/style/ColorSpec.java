package domain.style;

/**
 * Unresolved color reference as written in styles, themes and rule parts.
 *
 * <p>Every variant may carry a tint in [-1, 1]; 0 means unchanged.</p>
 */
public abstract class ColorSpec {

    private final double tint;

    private ColorSpec(double tint) {
        this.tint = tint;
    }

    public static ColorSpec rgb(String argb, double tint) {
        return new Rgb(argb, tint);
    }

    public static ColorSpec theme(int index, double tint) {
        return new ThemeRef(index, tint);
    }

    public static ColorSpec indexed(int index, double tint) {
        return new Indexed(index, tint);
    }

    public static ColorSpec auto() {
        return Auto.INSTANCE;
    }

    public double getTint() {
        return tint;
    }

    public static final class Rgb extends ColorSpec {
        private final String argb;

        private Rgb(String argb, double tint) {
            super(tint);
            this.argb = argb;
        }

        /** RRGGBB or AARRGGBB, as written. */
        public String getArgb() {
            return argb;
        }
    }

    public static final class ThemeRef extends ColorSpec {
        private final int index;

        private ThemeRef(int index, double tint) {
            super(tint);
            this.index = index;
        }

        public int getIndex() {
            return index;
        }
    }

    public static final class Indexed extends ColorSpec {
        private final int index;

        private Indexed(int index, double tint) {
            super(tint);
            this.index = index;
        }

        public int getIndex() {
            return index;
        }
    }

    public static final class Auto extends ColorSpec {
        private static final Auto INSTANCE = new Auto();

        private Auto() {
            super(0.0);
        }
    }
}
