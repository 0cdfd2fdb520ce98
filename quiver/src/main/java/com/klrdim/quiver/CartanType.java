package com.klrdim.quiver;

import com.klrdim.common.UnknownCartanTypeException;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cartan-type descriptor: family letter, rank, and whether the untwisted
 * affine extension is meant. Purely syntactic; rank validity is checked by
 * the {@link QuiverDataProvider}.
 */
public final class CartanType {

    // A3, A_3, A2~, A2^1, A2^(1)
    private static final Pattern COMPACT =
            Pattern.compile("([A-G])_?(\\d+)(~|\\^1|\\^\\(1\\))?");
    // A,3  A,2,1  (also the bracketed/quoted list form once stripped)
    private static final Pattern LISTED =
            Pattern.compile("([A-G]),(\\d+)(?:,(\\d+))?");

    private final CartanFamily family;
    private final int rank;
    private final boolean affine;

    public CartanType(CartanFamily family, int rank, boolean affine) {
        this.family = Objects.requireNonNull(family, "family");
        this.rank = rank;
        this.affine = affine;
    }

    public static CartanType finite(CartanFamily family, int rank) {
        return new CartanType(family, rank, false);
    }

    public static CartanType affine(CartanFamily family, int rank) {
        return new CartanType(family, rank, true);
    }

    /**
     * Parses {@code "A3"}, {@code "A_3"}, {@code "['A',3]"}, {@code "A,3"} and the affine
     * forms {@code "A2~"}, {@code "A2^1"}, {@code "['A',2,1]"}, {@code "A,2,1"}.
     *
     * @throws UnknownCartanTypeException if the text is not a descriptor
     */
    public static CartanType parse(String text) {
        if (text == null) throw new UnknownCartanTypeException("Cartan type is null");
        String s = text.replaceAll("[\\s\\[\\]'\"]", "").toUpperCase(Locale.ROOT);

        Matcher m = COMPACT.matcher(s);
        if (m.matches()) {
            return new CartanType(CartanFamily.valueOf(m.group(1)), parseRank(m.group(2), text), m.group(3) != null);
        }
        m = LISTED.matcher(s);
        if (m.matches()) {
            boolean affine = false;
            if (m.group(3) != null) {
                if (!"1".equals(m.group(3))) {
                    throw new UnknownCartanTypeException("only untwisted affine types are supported: " + text);
                }
                affine = true;
            }
            return new CartanType(CartanFamily.valueOf(m.group(1)), parseRank(m.group(2), text), affine);
        }
        throw new UnknownCartanTypeException(text + " must be a Cartan type");
    }

    private static int parseRank(String digits, String text) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new UnknownCartanTypeException("rank out of range in " + text, e);
        }
    }

    public CartanFamily getFamily() { return family; }
    public int getRank() { return rank; }
    public boolean isAffine() { return affine; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CartanType that)) return false;
        return family == that.family && rank == that.rank && affine == that.affine;
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, rank, affine);
    }

    /** {@code B3} or {@code A2^(1)} */
    @Override
    public String toString() {
        return family.name() + rank + (affine ? "^(1)" : "");
    }
}
