package com.klrdim.api;

import com.klrdim.formula.core.DominantWeight;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Text forms accepted by the command line.
 *
 * A residue sequence is a list of labels separated by commas or whitespace
 * ({@code "2,3,3,2,1"}), optionally bracketed, or a run of single digits
 * ({@code "23321"}). A dominant weight is a residue sequence whose repeated
 * labels are multiplicities ({@code "1,1"} is 2 L_1).
 */
public final class InputParsers {

    private InputParsers() {}

    /** @throws IllegalArgumentException if a label is not a non-negative integer */
    public static List<Integer> parseSequence(String text) {
        if (text == null) throw new IllegalArgumentException("residue sequence is null");
        String s = text.trim();
        if (s.startsWith("[") || s.startsWith("(")) s = s.substring(1);
        if (s.endsWith("]") || s.endsWith(")")) s = s.substring(0, s.length() - 1);
        s = s.trim();
        if (s.isEmpty()) return Collections.emptyList();

        List<Integer> out = new ArrayList<>();
        if (s.matches("\\d+")) {
            for (char c : s.toCharArray()) out.add(c - '0');
            return out;
        }
        for (String tok : s.split("[,\\s]+")) {
            if (tok.isEmpty()) continue;
            if (!tok.matches("\\d+")) {
                throw new IllegalArgumentException("'" + tok + "' in '" + text + "' is not a vertex label");
            }
            try {
                out.add(Integer.parseInt(tok));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("vertex label out of range: " + tok, e);
            }
        }
        return out;
    }

    public static DominantWeight parseWeight(String text) {
        return DominantWeight.ofLabels(parseSequence(text));
    }
}
