package domain.output;

/** What the command line writes after a parse. */
public enum OutputFormat {
    /** Whole workbook model as JSON. */
    JSON,
    /** One sheet's display values as CSV. */
    CSV,
    /** Parse only; useful with the warning summary. */
    NONE
}
