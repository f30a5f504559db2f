package domain.model;

final class NullParseWarningSink implements ParseWarningSink {

    static final NullParseWarningSink INSTANCE = new NullParseWarningSink();

    private NullParseWarningSink() {
    }

    @Override
    public void warn(ParseWarning warning) {
        // no-op
    }
}
