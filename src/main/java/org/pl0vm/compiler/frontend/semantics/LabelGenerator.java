package org.pl0vm.compiler.frontend.semantics;

/**
 * Produces the unique branch labels of one compilation unit: {@code label_100},
 * {@code label_101}, ...
 */
public class LabelGenerator {

    public static final String PREFIX = "label_";
    public static final int FIRST = 100;

    private int counter = FIRST;

    public String next() {
        return PREFIX + counter++;
    }
}
