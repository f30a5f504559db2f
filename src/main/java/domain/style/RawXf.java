package domain.style;

/**
 * One {@code <xf>} from cellXfs or cellStyleXfs.
 *
 * <p>Ids are null when the attribute is absent. Apply flags are tri-state: null (absent),
 * TRUE ("1"/"true") or FALSE ("0"/"false"). Alignment/protection are null when the child
 * element is absent.</p>
 */
public record RawXf(
        Integer numFmtId,
        Integer fontId,
        Integer fillId,
        Integer borderId,
        Integer xfId,
        Boolean applyNumberFormat,
        Boolean applyFont,
        Boolean applyFill,
        Boolean applyBorder,
        Boolean applyAlignment,
        Boolean applyProtection,
        RawAlignment alignment,
        RawProtection protection
) {
    public static final RawXf EMPTY = new RawXf(null, null, null, null, null,
            null, null, null, null, null, null, null, null);
}
