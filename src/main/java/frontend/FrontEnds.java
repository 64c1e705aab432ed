package frontend;

import syntax.Language;

public final class FrontEnds {

    private FrontEnds() {
    }

    public static FrontEnd forLanguage(Language language, int pythonTabSize, boolean skipDocstrings) {
        switch (language) {
            case PYTHON:
                return new PythonFrontEnd(pythonTabSize, skipDocstrings);
            case JAVA:
                return new JavaFrontEnd();
            default:
                throw new IllegalArgumentException("No front end for " + language);
        }
    }

    public static FrontEnd forLanguage(Language language) {
        return forLanguage(language, 8, false);
    }
}
