package domain.model;

public final class Sparkline {

    private final String location;
    private final String dataRange;

    public Sparkline(String location, String dataRange) {
        this.location = location;
        this.dataRange = dataRange;
    }

    /** Cell the sparkline is drawn in, e.g. {@code F2}. */
    public String getLocation() {
        return location;
    }

    /** Source range formula, e.g. {@code Sheet1!A2:E2}. */
    public String getDataRange() {
        return dataRange;
    }
}
