package frontend;

import syntax.Language;
import syntax.SourceUnit;

/**
 * Turns the source text of one language family into a {@link SourceUnit}.
 * Implementations are stateless and safe to share between threads.
 */
public interface FrontEnd {

    Language getLanguage();

    /**
     * Parses the text and selects the first function or method it defines.
     */
    default SourceUnit parse(String sourceText) throws ParseException {
        return parse(sourceText, null);
    }

    /**
     * Parses the text and selects the named function or method.
     *
     * @param functionName name to select, or null for the first one
     * @throws ParseException on syntax errors, or when no matching function exists
     */
    SourceUnit parse(String sourceText, String functionName) throws ParseException;
}
