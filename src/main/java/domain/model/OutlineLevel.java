package domain.model;

/**
 * Outline (grouping) level of one row or column.
 *
 * @param index 0-based row or column index
 * @param level 1..7
 */
public record OutlineLevel(int index, int level, boolean collapsed, boolean hidden) {
}
