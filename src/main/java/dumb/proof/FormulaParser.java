package dumb.proof;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for formulas in Polish (prefix) notation, e.g. {@code → A ∨ A B} for {@code (A→(A∨B))}.
 * <p>
 * Connectives: {@code ¬ ~ !} negation, {@code ∧ &} conjunction, {@code ∨ |} disjunction,
 * {@code → > ->} implication. {@code T} and {@code F} are the constants. Any other run of letters,
 * digits and {@code _} is a variable, so adjacent variables must be separated by whitespace.
 * {@code ;} starts a comment running to the end of the line.
 */
public class FormulaParser {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private FormulaParser(Reader reader) {
        this.reader = reader;
    }

    /** Parses exactly one formula. */
    public static Formula parse(String text) throws ParseException {
        var all = parseAll(text);
        if (all.size() != 1)
            throw new ParseException("Expected exactly one formula but found " + all.size(), text);
        return all.get(0);
    }

    /** Parses a whitespace-separated sequence of formulas. */
    public static List<Formula> parseAll(String text) throws ParseException {
        try (var reader = new StringReader(text)) {
            var parser = new FormulaParser(reader);
            var formulas = new ArrayList<Formula>();
            parser.skipWhitespaceAndComments();
            while (parser.peek() != -1) {
                formulas.add(parser.parseFormula());
                parser.skipWhitespaceAndComments();
            }
            return formulas;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    private static boolean isNameChar(int c) {
        return c != -1 && (Character.isLetterOrDigit(c) || c == '_');
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) {
                contextBuffer.deleteCharAt(0);
            }
            if (currentChar != -1) {
                contextBuffer.append((char) currentChar);
            }
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == ';') {
                consumeChar();
                while (peek() != '\n' && peek() != -1) {
                    consumeChar();
                }
            } else {
                return;
            }
        }
    }

    private Formula parseFormula() throws IOException, ParseException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected EOF while parsing formula");
        switch (c) {
            case '¬', '~', '!' -> {
                consumeChar();
                return new Formula.Neg(parseFormula());
            }
            case '∧', '&' -> {
                consumeChar();
                return new Formula.And(parseFormula(), parseFormula());
            }
            case '∨', '|' -> {
                consumeChar();
                return new Formula.Or(parseFormula(), parseFormula());
            }
            case '→', '>' -> {
                consumeChar();
                return new Formula.Imp(parseFormula(), parseFormula());
            }
            case '-' -> {
                consumeChar();
                var next = consumeChar();
                if (next != '>') throw createParseException("Expected '>' after '-'", next == -1 ? "EOF" : "'" + (char) next + "'");
                return new Formula.Imp(parseFormula(), parseFormula());
            }
            default -> {
                return parseAtom();
            }
        }
    }

    private Formula parseAtom() throws IOException, ParseException {
        if (!isNameChar(peek()))
            throw createParseException("Unexpected character '" + (char) peek() + "'");
        var sb = new StringBuilder();
        while (isNameChar(peek())) {
            sb.append((char) consumeChar());
        }
        var name = sb.toString();
        if (name.equals(Formula.Const.TRUE.toString())) return Formula.Const.TRUE;
        if (name.equals(Formula.Const.FALSE.toString())) return Formula.Const.FALSE;
        try {
            return Formula.Var.of(name);
        } catch (IllegalArgumentException e) {
            throw createParseException(e.getMessage());
        }
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, "");
        }

        public ParseException(String message, String context) {
            this(message, -1, -1, context);
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
