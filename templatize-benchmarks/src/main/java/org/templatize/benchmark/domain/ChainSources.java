package org.templatize.benchmark.domain;

/**
 * Java sources holding one string concatenation chain each, with the position of its first "+".
 */
public final class ChainSources {

    public static final int LINE = 3;

    private static final String PREFIX = """
            class Report {
                String render(String faction, int influence, int stability, double treasury, boolean atWar) {
                    return\s""";

    private static final String SUFFIX = """
            ;
                }
            }
            """;

    private ChainSources() {
    }

    public static String shortChain() {
        return PREFIX + "\"Faction \" + faction + \" (\" + (atWar ? \"at war\" : \"at peace\") + \")\"" + SUFFIX;
    }

    /**
     * {@code operands} alternating literal and parameter operands.
     */
    public static String longChain(int operands) {
        StringBuilder sb = new StringBuilder(PREFIX).append("\"start\"");
        String[] parameters = {"faction", "influence", "stability", "treasury"};
        for (int i = 1; i < operands; i++) {
            sb.append(" + ");
            if (i % 2 == 0) {
                sb.append("\"#").append(i).append(": \"");
            } else {
                sb.append(parameters[(i / 2) % parameters.length]);
            }
        }
        return sb.append(SUFFIX).toString();
    }

    /**
     * Column of the first "+" on {@link #LINE}.
     */
    public static int firstPlusColumn(String source) {
        String line = source.split("\n")[LINE - 1];
        return line.indexOf(" + ") + 2;
    }
}
