package com.todotracker.core.language;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table mapping file extensions to comment syntax.
 *
 * <p>Lookup is a case-insensitive exact match on the extension and runs in constant time,
 * since it is performed once per file on the parallel scan path. Files whose extension is
 * not registered have no resolvable syntax; callers skip them.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LanguageRegistry registry = LanguageRegistry.defaultRegistry();
 * registry.lookup("RS").map(LanguageSyntax::name); // Optional[Rust]
 * registry.lookup(Path.of("lib/util.py"));          // Optional[Python]
 * }</pre>
 */
public final class LanguageRegistry {

    public static final LanguageSyntax RUST = LanguageSyntax.of("Rust", Set.of("rs"), "//", "/*", "*/");
    public static final LanguageSyntax GO = LanguageSyntax.of("Go", Set.of("go"), "//", "/*", "*/");
    public static final LanguageSyntax PYTHON = LanguageSyntax.of("Python", Set.of("py", "pyi"), "#");
    public static final LanguageSyntax JAVASCRIPT =
        LanguageSyntax.of("JavaScript", Set.of("js", "jsx", "mjs", "cjs"), "//", "/*", "*/");
    public static final LanguageSyntax TYPESCRIPT =
        LanguageSyntax.of("TypeScript", Set.of("ts", "tsx", "mts", "cts"), "//", "/*", "*/");
    public static final LanguageSyntax JAVA = LanguageSyntax.of("Java", Set.of("java"), "//", "/*", "*/");
    public static final LanguageSyntax C = LanguageSyntax.of("C", Set.of("c", "h"), "//", "/*", "*/");
    public static final LanguageSyntax CPP =
        LanguageSyntax.of("C++", Set.of("cpp", "cxx", "cc", "hpp", "hxx", "hh"), "//", "/*", "*/");
    public static final LanguageSyntax CSHARP = LanguageSyntax.of("C#", Set.of("cs"), "//", "/*", "*/");
    public static final LanguageSyntax RUBY = LanguageSyntax.of("Ruby", Set.of("rb", "rake", "gemspec"), "#");
    public static final LanguageSyntax KOTLIN = LanguageSyntax.of("Kotlin", Set.of("kt", "kts"), "//", "/*", "*/");
    public static final LanguageSyntax SCALA = LanguageSyntax.of("Scala", Set.of("scala", "sc"), "//", "/*", "*/");
    public static final LanguageSyntax SWIFT = LanguageSyntax.of("Swift", Set.of("swift"), "//", "/*", "*/");
    public static final LanguageSyntax GROOVY =
        LanguageSyntax.of("Groovy", Set.of("groovy", "gradle"), "//", "/*", "*/");
    public static final LanguageSyntax DART = LanguageSyntax.of("Dart", Set.of("dart"), "//", "/*", "*/");
    public static final LanguageSyntax PHP = LanguageSyntax.of("PHP", Set.of("php"), "//", "/*", "*/");
    public static final LanguageSyntax SHELL = LanguageSyntax.of("Shell", Set.of("sh", "bash", "zsh"), "#");
    public static final LanguageSyntax YAML = LanguageSyntax.of("YAML", Set.of("yml", "yaml"), "#");
    public static final LanguageSyntax SQL = LanguageSyntax.of("SQL", Set.of("sql"), "--", "/*", "*/");
    public static final LanguageSyntax LUA = LanguageSyntax.of("Lua", Set.of("lua"), "--", "--[[", "]]");
    public static final LanguageSyntax HASKELL = LanguageSyntax.of("Haskell", Set.of("hs"), "--", "{-", "-}");
    public static final LanguageSyntax CSS = LanguageSyntax.of("CSS", Set.of("css"), null, "/*", "*/");
    public static final LanguageSyntax SCSS = LanguageSyntax.of("SCSS", Set.of("scss", "less"), "//", "/*", "*/");
    public static final LanguageSyntax MARKUP =
        LanguageSyntax.of("HTML/XML", Set.of("html", "htm", "xml", "xhtml", "svg"), null, "<!--", "-->");

    private static final List<LanguageSyntax> BUILT_IN = List.of(
        RUST, GO, PYTHON, JAVASCRIPT, TYPESCRIPT, JAVA, C, CPP, CSHARP, RUBY,
        KOTLIN, SCALA, SWIFT, GROOVY, DART, PHP, SHELL, YAML, SQL, LUA, HASKELL, CSS, SCSS, MARKUP
    );

    private static final LanguageRegistry DEFAULT = new LanguageRegistry(BUILT_IN);

    private final List<LanguageSyntax> languages;
    private final Map<String, LanguageSyntax> byExtension;

    /**
     * Builds a registry from a list of languages.
     *
     * @param languages languages to register
     * @throws IllegalArgumentException if two languages claim the same extension
     */
    public LanguageRegistry(List<LanguageSyntax> languages) {
        this.languages = List.copyOf(languages);
        Map<String, LanguageSyntax> index = new HashMap<>();
        for (LanguageSyntax language : this.languages) {
            for (String extension : language.extensions()) {
                LanguageSyntax previous = index.putIfAbsent(extension, language);
                if (previous != null) {
                    throw new IllegalArgumentException("Extension '" + extension + "' registered by both "
                        + previous.name() + " and " + language.name());
                }
            }
        }
        this.byExtension = Collections.unmodifiableMap(index);
    }

    /**
     * Returns the process-wide registry of built-in languages.
     */
    public static LanguageRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Looks up comment syntax by extension.
     *
     * @param extension extension without the dot, any case
     * @return syntax, or empty for unknown or empty extensions
     */
    public Optional<LanguageSyntax> lookup(String extension) {
        if (extension == null || extension.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byExtension.get(extension.toLowerCase(Locale.ROOT)));
    }

    /**
     * Looks up comment syntax by the extension of a file name.
     *
     * @param file file path
     * @return syntax, or empty if the file has no registered extension
     */
    public Optional<LanguageSyntax> lookup(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? lookup(name.substring(lastDot + 1)) : Optional.empty();
    }

    public List<LanguageSyntax> languages() {
        return languages;
    }
}
