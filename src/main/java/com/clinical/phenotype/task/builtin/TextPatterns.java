package com.clinical.phenotype.task.builtin;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Regex helpers shared by the built-in tasks.
 */
final class TextPatterns {

    private TextPatterns() {
    }

    /**
     * Case-insensitive whole-word match of a term; inner whitespace matches any whitespace run.
     */
    static Pattern wholeWord(String term) {
        String[] words = term.trim().split("\\s+");
        StringBuilder regex = new StringBuilder("(?<![\\w])");
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(words[i]));
        }
        regex.append("(?![\\w])");
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    static boolean overlaps(List<int[]> spans, int start, int end) {
        for (int[] span : spans) {
            if (start < span[1] && span[0] < end) {
                return true;
            }
        }
        return false;
    }
}
