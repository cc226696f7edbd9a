package org.sasslite.sass.parse;

/**
 * Describes indentation strings for error messages: "2 spaces", "1 tab".
 */
final class Indentation {

    private Indentation() {
    }

    static String describe(String indentation) {
        return describe(indentation, false);
    }

    /**
     * @param was Append "was"/"were" so the description can open a sentence
     *            ("4 spaces were used ...")
     */
    static String describe(String indentation, boolean was) {
        String noun;
        if (indentation.indexOf('\t') < 0) {
            noun = "space";
        } else if (indentation.indexOf(' ') < 0) {
            noun = "tab";
        } else {
            return quote(indentation) + (was ? " was" : "");
        }

        boolean singular = indentation.length() == 1;
        String verb = was ? (singular ? " was" : " were") : "";
        return indentation.length() + " " + noun + (singular ? "" : "s") + verb;
    }

    private static String quote(String indentation) {
        return "\"" + indentation.replace("\t", "\\t") + "\"";
    }
}
