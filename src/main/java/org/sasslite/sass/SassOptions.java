package org.sasslite.sass;

import java.util.Locale;
import java.util.Map;

/**
 * Options for parsing an indented style sheet.
 *
 * <p>{@code style} and {@code lineComments} are not used by the parser itself;
 * they ride along on the {@link org.sasslite.sass.tree.RootNode} for the
 * rendering stage.
 *
 * @param style          Output style hint for the renderer
 * @param filename       Source file name attached to nodes and diagnostics, may be null
 * @param line           Line number of the first template line
 * @param propertySyntax Required property syntax, or null to accept both
 * @param lineComments   Whether the renderer should emit source line comments
 */
public record SassOptions(
        Style style,
        String filename,
        int line,
        PropertySyntax propertySyntax,
        boolean lineComments) {

    public enum Style {
        NESTED,
        EXPANDED,
        COMPACT,
        COMPRESSED
    }

    public enum PropertySyntax {
        /** {@code :name value} */
        OLD,
        /** {@code name: value} */
        NEW
    }

    public SassOptions {
        if (style == null) {
            style = Style.NESTED;
        }
        if (line < 1) {
            throw new IllegalArgumentException("Starting line must be at least 1, got " + line);
        }
    }

    public static SassOptions defaults() {
        return new SassOptions(Style.NESTED, null, 1, null, false);
    }

    public SassOptions withFilename(String filename) {
        return new SassOptions(style, filename, line, propertySyntax, lineComments);
    }

    public SassOptions withLine(int line) {
        return new SassOptions(style, filename, line, propertySyntax, lineComments);
    }

    public SassOptions withPropertySyntax(PropertySyntax propertySyntax) {
        return new SassOptions(style, filename, line, propertySyntax, lineComments);
    }

    public SassOptions withStyle(Style style) {
        return new SassOptions(style, filename, line, propertySyntax, lineComments);
    }

    public SassOptions withLineComments(boolean lineComments) {
        return new SassOptions(style, filename, line, propertySyntax, lineComments);
    }

    /**
     * Builds options from string settings, e.g. a properties file or command
     * line flags. Recognized keys: {@code style}, {@code filename}, {@code line},
     * {@code property_syntax}, {@code line_comments}, and the legacy aliases
     * {@code attribute_syntax} ({@code normal} / {@code alternate}) and
     * {@code line_numbers}. Unknown keys are ignored.
     *
     * @throws IllegalArgumentException if a recognized key has an invalid value
     */
    public static SassOptions fromMap(Map<String, String> settings) {
        SassOptions options = defaults();

        String style = settings.get("style");
        if (style != null) {
            options = options.withStyle(parseEnum(Style.class, "style", style));
        }

        String filename = settings.get("filename");
        if (filename != null) {
            options = options.withFilename(filename);
        }

        String line = settings.get("line");
        if (line != null) {
            try {
                options = options.withLine(Integer.parseInt(line.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid line option: " + line, e);
            }
        }

        String lineComments = settings.getOrDefault("line_comments", settings.get("line_numbers"));
        if (lineComments != null) {
            options = options.withLineComments(Boolean.parseBoolean(lineComments.trim()));
        }

        String syntax = settings.getOrDefault("property_syntax", settings.get("attribute_syntax"));
        if (syntax != null) {
            options = options.withPropertySyntax(parsePropertySyntax(syntax));
        }

        return options;
    }

    private static PropertySyntax parsePropertySyntax(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "old", "normal" -> PropertySyntax.OLD;
            case "new", "alternate" -> PropertySyntax.NEW;
            default -> throw new IllegalArgumentException("Invalid property_syntax option: " + value);
        };
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + key + " option: " + value, e);
        }
    }
}
