package io.codeforesight.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Source language tag. Decides which parser the normalizer tries first.
 */
public enum Language {
    C("c", Set.of(".c", ".h"), true),
    CPP("cpp", Set.of(".cpp", ".cc", ".cxx", ".hpp", ".hh"), true),
    JAVA("java", Set.of(".java"), true),
    JAVASCRIPT("javascript", Set.of(".js", ".jsx", ".ts", ".tsx", ".mjs"), true),
    GO("go", Set.of(".go"), true),
    CSHARP("csharp", Set.of(".cs"), true),
    PYTHON("python", Set.of(".py"), false),
    OTHER("other", Set.of(), false);

    private final String tag;
    private final Set<String> extensions;
    private final boolean braceDelimited;

    Language(String tag, Set<String> extensions, boolean braceDelimited) {
        this.tag = tag;
        this.extensions = extensions;
        this.braceDelimited = braceDelimited;
    }

    public String tag() {
        return tag;
    }

    /**
     * True for languages whose function bodies are delimited by braces.
     */
    public boolean isBraceDelimited() {
        return braceDelimited;
    }

    /**
     * Parses a user-supplied tag ("c", "C++", "py", ...).
     */
    public static Language fromTag(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "c" -> C;
            case "cpp", "c++", "cxx" -> CPP;
            case "java" -> JAVA;
            case "javascript", "js", "typescript", "ts" -> JAVASCRIPT;
            case "go", "golang" -> GO;
            case "csharp", "c#", "cs" -> CSHARP;
            case "python", "py" -> PYTHON;
            default -> OTHER;
        };
    }

    /**
     * Detects the language from the file extension, then from content hints.
     */
    public static Language detect(Path path, String text) {
        if (path != null && path.getFileName() != null) {
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            int dot = name.lastIndexOf('.');
            if (dot >= 0) {
                String ext = name.substring(dot);
                for (Language language : values()) {
                    if (language.extensions.contains(ext)) {
                        return language;
                    }
                }
            }
        }
        if (text != null && (text.contains("#include") || text.contains("printf(") || text.contains("malloc("))) {
            return C;
        }
        return OTHER;
    }
}
