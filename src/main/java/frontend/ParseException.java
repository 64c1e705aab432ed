package frontend;

import syntax.CfgAnalysisException;

/** Malformed or unsupported source text. */
public class ParseException extends CfgAnalysisException {

    public ParseException(int line, String message) {
        super(line, message);
    }

    public ParseException(int line, String message, Throwable cause) {
        super(line, message, cause);
    }

    @Override
    public String toString() {
        return "ParseError{line=" + getLine() + ", message=" + getMessage() + "}";
    }
}
