package domain.style;

import domain.model.Theme;

import java.util.List;
import java.util.Locale;

/**
 * Turns a {@link ColorSpec} into {@code #RRGGBB} using the workbook theme and an optional
 * custom indexed palette ({@code <colors><indexedColors>}).
 */
public final class ColorResolver {

    private final Theme theme;
    private final List<String> customIndexed;

    public ColorResolver(Theme theme, List<String> customIndexed) {
        this.theme = theme == null ? Theme.office() : theme;
        this.customIndexed = customIndexed == null ? List.of() : List.copyOf(customIndexed);
    }

    /**
     * @return uppercase {@code #RRGGBB}, or null when the reference cannot be resolved
     */
    public String resolve(ColorSpec spec) {
        if (spec == null) return null;

        String base;
        if (spec instanceof ColorSpec.Rgb rgb) {
            base = normalizeRgb(rgb.getArgb());
        } else if (spec instanceof ColorSpec.ThemeRef ref) {
            base = theme.colorAt(ref.getIndex());
        } else if (spec instanceof ColorSpec.Indexed idx) {
            base = indexed(idx.getIndex());
        } else {
            base = "#000000";
        }

        if (base == null) return null;
        double tint = spec.getTint();
        return tint == 0.0 ? base : applyTint(base, tint);
    }

    private String indexed(int index) {
        if (index == IndexedPalette.SYSTEM_FOREGROUND) return "#000000";
        if (index == IndexedPalette.SYSTEM_BACKGROUND) return "#FFFFFF";
        if (index >= 0 && index < customIndexed.size()) {
            String c = normalizeRgb(customIndexed.get(index));
            if (c != null) return c;
        }
        return IndexedPalette.get(index);
    }

    /**
     * {@code FFRRGGBB} / {@code RRGGBB} / {@code #RRGGBB} to {@code #RRGGBB}; null when malformed.
     */
    public static String normalizeRgb(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.startsWith("#")) s = s.substring(1);
        if (s.length() == 8) s = s.substring(2);
        if (s.length() != 6) return null;
        for (int i = 0; i < 6; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) return null;
        }
        return "#" + s.toUpperCase(Locale.ROOT);
    }

    /**
     * Lightens (tint &gt; 0) toward white or darkens (tint &lt; 0) toward black by scaling
     * HSL luminance.
     */
    public static String applyTint(String hex, double tint) {
        String norm = normalizeRgb(hex);
        if (norm == null) return hex;
        int rgb = Integer.parseInt(norm.substring(1), 16);
        double r = ((rgb >> 16) & 0xFF) / 255.0;
        double g = ((rgb >> 8) & 0xFF) / 255.0;
        double b = (rgb & 0xFF) / 255.0;

        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double l = (max + min) / 2.0;
        double h = 0.0;
        double s = 0.0;
        if (max != min) {
            double d = max - min;
            s = l > 0.5 ? d / (2.0 - max - min) : d / (max + min);
            if (max == r) {
                h = (g - b) / d + (g < b ? 6.0 : 0.0);
            } else if (max == g) {
                h = (b - r) / d + 2.0;
            } else {
                h = (r - g) / d + 4.0;
            }
            h /= 6.0;
        }

        if (tint < 0) {
            l = l * (1.0 + tint);
        } else {
            l = l * (1.0 - tint) + tint;
        }
        l = Math.max(0.0, Math.min(1.0, l));

        double nr;
        double ng;
        double nb;
        if (s == 0.0) {
            nr = ng = nb = l;
        } else {
            double q = l < 0.5 ? l * (1.0 + s) : l + s - l * s;
            double p = 2.0 * l - q;
            nr = hueToRgb(p, q, h + 1.0 / 3.0);
            ng = hueToRgb(p, q, h);
            nb = hueToRgb(p, q, h - 1.0 / 3.0);
        }
        return String.format(Locale.ROOT, "#%02X%02X%02X",
                Math.round(nr * 255.0), Math.round(ng * 255.0), Math.round(nb * 255.0));
    }

    private static double hueToRgb(double p, double q, double t) {
        if (t < 0) t += 1.0;
        if (t > 1) t -= 1.0;
        if (t < 1.0 / 6.0) return p + (q - p) * 6.0 * t;
        if (t < 1.0 / 2.0) return q;
        if (t < 2.0 / 3.0) return p + (q - p) * (2.0 / 3.0 - t) * 6.0;
        return p;
    }
}
