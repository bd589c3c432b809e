package superss.lexer;

/**
 * @param offset 0-based char offset into the source
 * @param line   1-based
 * @param column 1-based
 */
public record SourcePosition(int offset, int line, int column) {

    public static final SourcePosition START = new SourcePosition(0, 1, 1);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
