package domain.conditional;

import domain.model.RangeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rule group: the ranges of one {@code <conditionalFormatting sqref>} and its rules.
 */
public final class ConditionalFormatting {

    private final String sqref;
    private final List<RangeRef> ranges;
    private final List<CfRule> rules = new ArrayList<>();

    public ConditionalFormatting(String sqref, List<RangeRef> ranges) {
        this.sqref = sqref;
        this.ranges = List.copyOf(ranges);
    }

    public void addRule(CfRule rule) {
        rules.add(rule);
    }

    public boolean covers(int row, int col) {
        for (RangeRef r : ranges) {
            if (r.contains(row, col)) return true;
        }
        return false;
    }

    public String getSqref() {
        return sqref;
    }

    public List<RangeRef> getRanges() {
        return ranges;
    }

    public List<CfRule> getRules() {
        return Collections.unmodifiableList(rules);
    }
}
