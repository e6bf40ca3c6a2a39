package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Seeded random texts over the first {@code alphabetSize} letters of {@link #ALPHABET}.
 * Small alphabets give many repeats, which is what exercises suffix links and splits.
 */
public class Generator {
    public static final char[] ALPHABET = (
            // English lower-case
            "abcdefghijklmnopqrstuvwxyz" +
                    // English upper-case
                    "ABCDEFGHIJKLMNOPQRSTUVWXYZ" +
                    // Digits
                    "0123456789" +
                    // Greek lower-case
                    "αβγδεζηθικλμνξοπρστυφχψω"
    ).toCharArray();

    private Generator() {
    }

    public static String generateUniform(int length, int alphabetSize, long seed) {
        checkArguments(length, alphabetSize);

        // Seeded random number generator for reproducibility
        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = ALPHABET[rng.nextInt(alphabetSize)];
        }
        return new String(chars);
    }

    public static String generateZipf(int length, int alphabetSize, double exponent, long seed) {
        checkArguments(length, alphabetSize);
        if (exponent <= 0.0) {
            throw new IllegalArgumentException("exponent must be positive");
        }

        RandomGenerator rng = new Well19937c(seed);

        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);

        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            int rank = dist.sample();                 // 1 .. alphabetSize
            chars[i] = ALPHABET[rank - 1];
        }
        return new String(chars);
    }

    private static void checkArguments(int length, int alphabetSize) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (alphabetSize <= 0 || alphabetSize > ALPHABET.length) {
            throw new IllegalArgumentException("alphabetSize must be in [1, " + ALPHABET.length + "]");
        }
    }
}
