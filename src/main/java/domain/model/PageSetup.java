package domain.model;

/**
 * {@code <pageSetup>} print settings.
 *
 * @param paperSize   paper code (1 = Letter, 9 = A4), null when absent
 * @param orientation {@code portrait} or {@code landscape}
 * @param scale       print scale percentage
 */
public record PageSetup(Integer paperSize, String orientation, Integer scale, Integer fitToWidth, Integer fitToHeight) {

    public boolean isLandscape() {
        return "landscape".equals(orientation);
    }
}
