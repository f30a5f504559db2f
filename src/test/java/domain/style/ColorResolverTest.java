package domain.style;

import domain.model.Theme;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColorResolverTest {

    private final ColorResolver resolver = new ColorResolver(Theme.office(), List.of());

    @Test
    void should_normalize_argb_to_uppercase_hex() {
        assertEquals("#FF0000", ColorResolver.normalizeRgb("ffff0000"));
        assertEquals("#00FF00", ColorResolver.normalizeRgb("#00ff00"));
        assertNull(ColorResolver.normalizeRgb("zz0000"));
        assertNull(ColorResolver.normalizeRgb("123"));
    }

    @Test
    void should_lighten_and_darken_with_tint() {
        assertEquals("#808080", ColorResolver.applyTint("#000000", 0.5));
        assertEquals("#808080", ColorResolver.applyTint("#FFFFFF", -0.5));
        assertEquals("#FF0000", resolver.resolve(ColorSpec.rgb("FFFF0000", 0.0)));
    }

    @Test
    void should_swap_light_and_dark_theme_slots() {
        assertEquals("#FFFFFF", resolver.resolve(ColorSpec.theme(0, 0.0)));
        assertEquals("#000000", resolver.resolve(ColorSpec.theme(1, 0.0)));
        assertEquals("#E7E6E6", resolver.resolve(ColorSpec.theme(2, 0.0)));
        assertEquals("#44546A", resolver.resolve(ColorSpec.theme(3, 0.0)));
        assertEquals("#4472C4", resolver.resolve(ColorSpec.theme(4, 0.0)));
        assertNull(resolver.resolve(ColorSpec.theme(12, 0.0)));
    }

    @Test
    void should_prefer_custom_indexed_palette() {
        ColorResolver custom = new ColorResolver(Theme.office(), List.of("FF112233"));
        assertEquals("#112233", custom.resolve(ColorSpec.indexed(0, 0.0)));
        assertEquals("#000000", custom.resolve(ColorSpec.indexed(64, 0.0)));
        assertEquals("#FFFFFF", custom.resolve(ColorSpec.indexed(65, 0.0)));
    }
}
