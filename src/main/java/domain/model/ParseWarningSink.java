package domain.model;

/**
 * Sink for recoverable decoding conditions.
 *
 * <p>Decoders, the style resolver and the worksheet reader all report here, so callers can
 * collect warnings without the decoders knowing about the CLI.</p>
 */
public interface ParseWarningSink {

    static ParseWarningSink none() {
        return NullParseWarningSink.INSTANCE;
    }

    void warn(ParseWarning warning);
}
