package domain.model;

/**
 * {@code <dataValidation>} rule. Formulas are kept as text.
 *
 * <p>Note the OOXML quirk: {@code showDropDown="1"} hides the in-cell list arrow, so it is
 * exposed here as {@code suppressDropDown}.</p>
 */
public final class DataValidation {

    private final String sqref;
    private final String type;
    private final String operator;
    private final String formula1;
    private final String formula2;
    private final boolean allowBlank;
    private final boolean suppressDropDown;
    private final boolean showInputMessage;
    private final boolean showErrorMessage;
    private final String errorStyle;
    private final String promptTitle;
    private final String prompt;
    private final String errorTitle;
    private final String error;

    public DataValidation(String sqref, String type, String operator, String formula1, String formula2,
                          boolean allowBlank, boolean suppressDropDown, boolean showInputMessage,
                          boolean showErrorMessage, String errorStyle, String promptTitle, String prompt,
                          String errorTitle, String error) {
        this.sqref = sqref;
        this.type = type == null ? "none" : type;
        this.operator = operator;
        this.formula1 = formula1;
        this.formula2 = formula2;
        this.allowBlank = allowBlank;
        this.suppressDropDown = suppressDropDown;
        this.showInputMessage = showInputMessage;
        this.showErrorMessage = showErrorMessage;
        this.errorStyle = errorStyle;
        this.promptTitle = promptTitle;
        this.prompt = prompt;
        this.errorTitle = errorTitle;
        this.error = error;
    }

    public String getSqref() {
        return sqref;
    }

    public String getType() {
        return type;
    }

    public String getOperator() {
        return operator;
    }

    public String getFormula1() {
        return formula1;
    }

    public String getFormula2() {
        return formula2;
    }

    public boolean isAllowBlank() {
        return allowBlank;
    }

    public boolean isSuppressDropDown() {
        return suppressDropDown;
    }

    public boolean isShowInputMessage() {
        return showInputMessage;
    }

    public boolean isShowErrorMessage() {
        return showErrorMessage;
    }

    public String getErrorStyle() {
        return errorStyle;
    }

    public String getPromptTitle() {
        return promptTitle;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getErrorTitle() {
        return errorTitle;
    }

    public String getError() {
        return error;
    }
}
