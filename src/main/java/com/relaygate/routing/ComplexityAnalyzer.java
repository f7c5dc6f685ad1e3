package com.relaygate.routing;

import com.relaygate.model.ComplexityAnalysis;
import com.relaygate.model.ComplexityClass;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Rule-based prompt classifier. Pure and deterministic.
 *
 * Score:
 * - +2 when the prompt has more than 100 words, +3 more above 500
 * - +2 when it contains a fenced code block
 * - +1 when it contains letters from a non-Latin script
 *
 * score <= 2 is simple, 3..5 moderate, above 5 complex.
 */
@Component
public class ComplexityAnalyzer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String CODE_FENCE = "```";

    public ComplexityClass classify(String promptText) {
        return analyze(promptText).getComplexity();
    }

    public ComplexityAnalysis analyze(String promptText) {
        String text = promptText == null ? "" : promptText;

        int wordCount = countWords(text);
        boolean hasCode = text.contains(CODE_FENCE);
        boolean hasNonLatin = containsNonLatinScript(text);

        int score = 0;
        if (wordCount > 100) {
            score += 2;
        }
        if (wordCount > 500) {
            score += 3;
        }
        if (hasCode) {
            score += 2;
        }
        if (hasNonLatin) {
            score += 1;
        }

        return ComplexityAnalysis.builder()
                .score(score)
                .complexity(toClass(score))
                .wordCount(wordCount)
                .hasCode(hasCode)
                .hasNonLatinScript(hasNonLatin)
                .build();
    }

    private ComplexityClass toClass(int score) {
        if (score <= 2) {
            return ComplexityClass.SIMPLE;
        }
        if (score <= 5) {
            return ComplexityClass.MODERATE;
        }
        return ComplexityClass.COMPLEX;
    }

    private int countWords(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(trimmed).length;
    }

    private boolean containsNonLatinScript(String text) {
        return text.codePoints()
                .filter(Character::isLetter)
                .anyMatch(cp -> {
                    Character.UnicodeScript script = Character.UnicodeScript.of(cp);
                    return script != Character.UnicodeScript.LATIN
                            && script != Character.UnicodeScript.COMMON
                            && script != Character.UnicodeScript.INHERITED;
                });
    }
}
