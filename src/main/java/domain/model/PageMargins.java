package domain.model;

/** Print margins in inches; attributes missing from {@code <pageMargins>} are 0. */
public record PageMargins(double left, double right, double top, double bottom, double header, double footer) {
}
