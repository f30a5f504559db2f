package infra.pkg;

/**
 * One {@code <Relationship>} from a {@code .rels} part.
 *
 * @param target for internal relationships the resolved package part path (no leading slash),
 *               for external ones the raw target (usually a URL)
 */
public record Relationship(String id, String type, String target, boolean external) {

    /** Type URI ends with {@code /suffix}, e.g. {@code comments}, {@code hyperlink}. */
    public boolean isType(String suffix) {
        return type != null && type.endsWith("/" + suffix);
    }
}
