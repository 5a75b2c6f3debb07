package io.routeflow.cli.ui;

/// ANSI text styling for CLI output with semantic color methods.
///
/// All methods return styled strings; output handling is the caller's responsibility.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);
/// System.out.println(styles.checkmark() + " " + styles.bold("Flow is valid"));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates an instance with the given color preference.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    // --- Text Formatting ---

    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Gray for secondary details such as ids and counts.
    public String gray(String text) {
        return style(text, GRAY);
    }

    public String dim(String text) {
        return style(text, DIM);
    }

    // --- Semantic Colors ---

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    /// Blue for node labels and other highlighted names.
    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Green on success, red on failure.
    public String successOrError(String text, boolean isSuccess) {
        return style(text, isSuccess ? GREEN : RED);
    }

    // --- Symbols ---

    public String arrow() {
        return style("→", BLUE);
    }

    public String bullet() {
        return style("•", GRAY);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    public String crossmark() {
        return style("✗", RED);
    }

    /// Exclamation mark for warnings.
    public String warnmark() {
        return style("!", YELLOW);
    }

    /// Full-width separator (62 chars).
    public String separator() {
        return style(" ─────────────────────────────────────────────────────────────", DIM);
    }

    // --- Text Layout ---

    /// Pads text on the right to the given width. Longer text is returned unchanged.
    public String padRight(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        return text + " ".repeat(width - text.length());
    }
}
