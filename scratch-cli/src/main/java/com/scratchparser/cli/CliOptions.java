package com.scratchparser.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 *
 * @param code   inline source given with {@code -c}, or null when absent or empty
 * @param files  source files, read in order
 */
public record CliOptions(String code, List<Path> files, boolean compact, boolean tokens, boolean help) {

    public CliOptions {
        files = List.copyOf(files);
    }

    public boolean hasInput() {
        return code != null || !files.isEmpty();
    }

    /**
     * Parses the argument vector.
     *
     * @return the options, or null if an option is unknown, {@code -c} lacks its argument,
     *         or inline code is combined with files
     */
    public static CliOptions parse(String[] args) {
        String code = null;
        List<Path> files = new ArrayList<>();
        boolean compact = false;
        boolean tokens = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-c" -> {
                    if (i + 1 >= args.length || code != null) {
                        return null;
                    }
                    code = args[++i];
                }
                case "--compact" -> compact = true;
                case "--tokens" -> tokens = true;
                case "-h", "--help" -> help = true;
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        return null;
                    }
                    files.add(Path.of(arg));
                }
            }
        }

        // An empty -c counts as not given, so files or usage take over
        if (code != null && code.isEmpty()) {
            code = null;
        }
        if (code != null && !files.isEmpty()) {
            return null;
        }
        return new CliOptions(code, files, compact, tokens, help);
    }

    static String usage() {
        return String.join("\n",
            "usage: scratch [--compact | --tokens] (-c <code> | <file>...)",
            "",
            "  -c <code>    parse the given source text",
            "  --compact    print the tree as single-line JSON",
            "  --tokens     print the token stream instead of the tree",
            "  -h, --help   show this message",
            "",
            "Files are concatenated in the order given before parsing.");
    }
}
