package com.scratchparser.cli;

import com.scratchparser.Lexer;
import com.scratchparser.ParseException;
import com.scratchparser.Parser;
import com.scratchparser.Token;
import com.scratchparser.ast.Program;
import com.scratchparser.json.AstJsonException;
import com.scratchparser.json.AstJsonProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads source text, parses it and prints the tree as JSON.
 */
public class ScratchCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final Logger logger = LoggerFactory.getLogger(ScratchCli.class);

    private final PrintStream out;
    private final PrintStream err;

    public ScratchCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        return new ScratchCli(out, err).run(args);
    }

    public int run(String[] args) {
        CliOptions options = CliOptions.parse(args);
        if (options == null) {
            err.println(CliOptions.usage());
            return EXIT_USAGE;
        }
        if (options.help()) {
            out.println(CliOptions.usage());
            return EXIT_OK;
        }
        if (!options.hasInput()) {
            err.println(CliOptions.usage());
            return EXIT_OK;
        }

        try {
            String source = readSource(options);
            String output = options.tokens() ? dumpTokens(source) : renderTree(source, options.compact());
            out.println(output);
            return EXIT_OK;
        } catch (IOException e) {
            reportFailure("cannot read input: " + e.getMessage(), e);
        } catch (ParseException e) {
            reportFailure(e.getMessage(), e);
        } catch (AstJsonException e) {
            reportFailure("cannot write tree: " + e.getMessage(), e);
        }
        return EXIT_FAILURE;
    }

    private void reportFailure(String message, Exception cause) {
        err.println("error: " + message);
        logger.debug("Run failed", cause);
    }

    private String readSource(CliOptions options) throws IOException {
        if (options.code() != null) {
            logger.debug("Parsing inline code, {} chars", options.code().length());
            return options.code();
        }
        StringBuilder source = new StringBuilder();
        for (Path file : options.files()) {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            logger.debug("Read {} ({} chars)", file, content.length());
            source.append(content);
        }
        logger.debug("Assembled source from {} file(s), {} chars", options.files().size(), source.length());
        return source.toString();
    }

    private static String renderTree(String source, boolean compact) {
        Program program = Parser.parse(source);
        AstJsonProvider provider = AstJsonProvider.getProvider();
        logger.debug("Writing {} statement(s) with the {} binding", program.body().size(), provider.getName());
        return provider.render(program, !compact);
    }

    private static String dumpTokens(String source) {
        StringBuilder sb = new StringBuilder();
        for (Token token : new Lexer(source).tokenize()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(token.type().label()).append("  ").append(token.value());
        }
        return sb.toString();
    }
}
