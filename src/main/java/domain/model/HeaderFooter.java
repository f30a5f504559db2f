package domain.model;

/** Print header and footer texts, kept with their {@code &}-codes. */
public record HeaderFooter(String oddHeader, String oddFooter, String evenHeader, String evenFooter,
                           String firstHeader, String firstFooter) {
}
