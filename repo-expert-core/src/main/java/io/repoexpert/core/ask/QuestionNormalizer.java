package io.repoexpert.core.ask;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Question normalization shared by the answer cache and ask routing.
 */
public final class QuestionNormalizer {
    public static final int MAX_SIMPLE_QUESTION_LENGTH = 280;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> COMPLEXITY_HINTS = List.of(
        "architecture",
        "design",
        "tradeoff",
        "compare",
        "cross-repo",
        "migration",
        "security",
        "performance",
        "benchmark",
        "root cause",
        "incident",
        "multi-step"
    );

    private QuestionNormalizer() {
    }

    public static String normalize(String question) {
        if (question == null) {
            return "";
        }
        return WHITESPACE.matcher(question.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * Short, single-line questions without any complexity hint qualify for the fast model.
     */
    public static boolean isSimpleQuestion(String question) {
        if (question == null) {
            return false;
        }
        String trimmed = question.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_SIMPLE_QUESTION_LENGTH || trimmed.contains("\n")) {
            return false;
        }
        String normalized = normalize(trimmed);
        return COMPLEXITY_HINTS.stream().noneMatch(normalized::contains);
    }
}
