package domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Resolved gradient fill. {@code type} is "linear" or "path"; stops carry hex colors.
 */
public final class GradientFill {

    private final String type;
    private final double degree;
    private final List<Stop> stops;

    public GradientFill(String type, double degree, List<Stop> stops) {
        this.type = type == null ? "linear" : type;
        this.degree = degree;
        this.stops = stops == null ? List.of() : List.copyOf(stops);
    }

    public String getType() {
        return type;
    }

    public double getDegree() {
        return degree;
    }

    public List<Stop> getStops() {
        return stops;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GradientFill that)) return false;
        return Double.compare(degree, that.degree) == 0 && type.equals(that.type) && stops.equals(that.stops);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, degree, stops);
    }

    public static final class Stop {
        private final double position;
        private final String color;

        public Stop(double position, String color) {
            this.position = position;
            this.color = color;
        }

        public double getPosition() {
            return position;
        }

        public String getColor() {
            return color;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Stop that)) return false;
            return Double.compare(position, that.position) == 0 && Objects.equals(color, that.color);
        }

        @Override
        public int hashCode() {
            return Objects.hash(position, color);
        }
    }
}
