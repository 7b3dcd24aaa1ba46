package org.assertflat;

public class DocumentParseException extends AssertFlatException {

    private final String documentName;
    private final int line;
    private final int column;

    public DocumentParseException(String message, String documentName, int line, int column) {
        super(message);
        this.documentName = documentName;
        this.line = line;
        this.column = column;
    }

    public String getDocumentName() {
        return documentName;
    }

    /**
     * @return 1-based line of the first parse problem, or -1 when the parser reported no location
     */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
