package syntax;

import java.util.Locale;

public enum Language {
    PYTHON("py"),
    JAVA("java");

    private final String extension;

    Language(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Resolves a language from a tag ({@code python}, {@code java}) or a file name.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static Language fromTag(String tag) {
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (t.equals(language.name().toLowerCase(Locale.ROOT)) || t.equals(language.extension)
                    || t.endsWith("." + language.extension)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unknown language: " + tag);
    }
}
