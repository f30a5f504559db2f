package domain.read;

import domain.model.ParseWarningSink;

/**
 * Knobs for one parse.
 *
 * <p>{@code evaluateConditionalFormats=false} skips decoding of conditional formatting blocks,
 * which is the most expensive optional content of a large sheet.</p>
 */
public final class ParseOptions {

    private static final ParseOptions DEFAULTS = new ParseOptions(true, ParseWarningSink.none());

    private final boolean evaluateConditionalFormats;
    private final ParseWarningSink warnings;

    private ParseOptions(boolean evaluateConditionalFormats, ParseWarningSink warnings) {
        this.evaluateConditionalFormats = evaluateConditionalFormats;
        this.warnings = warnings == null ? ParseWarningSink.none() : warnings;
    }

    public static ParseOptions defaults() {
        return DEFAULTS;
    }

    public ParseOptions withConditionalFormats(boolean enabled) {
        return new ParseOptions(enabled, warnings);
    }

    public ParseOptions withWarnings(ParseWarningSink sink) {
        return new ParseOptions(evaluateConditionalFormats, sink);
    }

    public boolean isEvaluateConditionalFormats() {
        return evaluateConditionalFormats;
    }

    public ParseWarningSink getWarnings() {
        return warnings;
    }
}
