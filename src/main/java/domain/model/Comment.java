package domain.model;

/**
 * Legacy cell comment (note). Rich runs are flattened to plain text.
 */
public final class Comment {

    private final String cellRef;
    private final String author;
    private final String text;

    public Comment(String cellRef, String author, String text) {
        this.cellRef = cellRef;
        this.author = author;
        this.text = text == null ? "" : text;
    }

    public String getCellRef() {
        return cellRef;
    }

    public String getAuthor() {
        return author;
    }

    public String getText() {
        return text;
    }
}
