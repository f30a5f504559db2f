package domain.conditional;

import java.util.List;

/**
 * 2- or 3-stop color scale; {@code colors} are resolved hex, parallel to {@code stops}.
 */
public final class ColorScale {

    private final List<CfValueObject> stops;
    private final List<String> colors;

    public ColorScale(List<CfValueObject> stops, List<String> colors) {
        this.stops = List.copyOf(stops);
        this.colors = List.copyOf(colors);
    }

    public List<CfValueObject> getStops() {
        return stops;
    }

    public List<String> getColors() {
        return colors;
    }
}
