package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with de-duplication on (code|part|message).
 *
 * <p>A 5,000-row sheet whose cells all point to the same broken xf would otherwise
 * produce 5,000 identical rows.</p>
 */
public final class ListParseWarningSink implements ParseWarningSink {

    private final List<ParseWarning> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListParseWarningSink(List<ParseWarning> target) {
        this.target = target;
    }

    private static String key(ParseWarning w) {
        return (w.getCode() == null ? "" : w.getCode().name()) + "|" + w.getPart() + "|" + w.getMessage();
    }

    @Override
    public void warn(ParseWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
