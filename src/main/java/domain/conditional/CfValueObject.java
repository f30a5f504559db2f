package domain.conditional;

/**
 * {@code <cfvo>}: where a scale/bar/icon threshold comes from.
 */
public final class CfValueObject {

    public enum Type {
        NUM, PERCENT, PERCENTILE, MIN, MAX, FORMULA, AUTO_MIN, AUTO_MAX;

        public static Type fromXml(String raw) {
            if (raw == null) return NUM;
            return switch (raw) {
                case "percent" -> PERCENT;
                case "percentile" -> PERCENTILE;
                case "min" -> MIN;
                case "max" -> MAX;
                case "formula" -> FORMULA;
                case "autoMin" -> AUTO_MIN;
                case "autoMax" -> AUTO_MAX;
                default -> NUM;
            };
        }
    }

    private final Type type;
    private final String value;
    private final boolean gte;

    public CfValueObject(Type type, String value, boolean gte) {
        this.type = type == null ? Type.NUM : type;
        this.value = value;
        this.gte = gte;
    }

    public Type getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    /** Icon sets: threshold is inclusive (default) or exclusive. */
    public boolean isGte() {
        return gte;
    }
}
