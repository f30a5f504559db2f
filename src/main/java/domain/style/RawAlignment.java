package domain.style;

public record RawAlignment(
        String horizontal,
        String vertical,
        Boolean wrapText,
        Boolean shrinkToFit,
        Integer indent,
        Integer textRotation,
        Integer readingOrder
) {
}
