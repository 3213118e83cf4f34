package edu.harvard.hms.dbmi.avillach.genoquery.processing.attribute;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import edu.harvard.hms.dbmi.avillach.genoquery.data.genotype.*;
import edu.harvard.hms.dbmi.avillach.genoquery.exception.QueryCompileException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;

/**
 * Recursive descent parser for attribute queries such as {@code "prb and not (mom or dad)"},
 * {@code "any(denovo, possible_denovo)"} or {@code "all(affected, male)"}.
 *
 * <pre>
 * expr    := and ("or" and)*
 * and     := unary ("and" unary)*
 * unary   := "not" unary | primary
 * primary := "(" expr ")" | ("any" | "all") "(" name ("," name)* ")" | name
 * </pre>
 *
 * Keywords and names are case-insensitive. Parsed trees are cached per expression.
 */
public class AttributeQueryParser {

    public static final AttributeQueryParser INHERITANCE = new AttributeQueryParser(Inheritance.VOCABULARY);
    public static final AttributeQueryParser ROLES = new AttributeQueryParser(Role.VOCABULARY);
    public static final AttributeQueryParser SEXES = new AttributeQueryParser(Sex.VOCABULARY);
    public static final AttributeQueryParser STATUSES = new AttributeQueryParser(Status.VOCABULARY);
    public static final AttributeQueryParser VARIANT_TYPES = new AttributeQueryParser(AlleleType.VOCABULARY);

    private final Vocabulary vocabulary;

    private final Cache<String, AttributeNode> parsed = CacheBuilder.newBuilder().maximumSize(1000).build();

    public AttributeQueryParser(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    /**
     * @param field filter field the expression came from, used to report problems
     */
    public AttributeNode parse(String field, String expression) throws QueryCompileException {
        try {
            return parsed.get(expression, () -> new Parser(field, expression).parseExpression());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof QueryCompileException) {
                throw (QueryCompileException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    private class Parser {
        private final String field;
        private final String expression;
        private final List<String> tokens;
        private int position;

        private Parser(String field, String expression) throws QueryCompileException {
            this.field = field;
            this.expression = expression;
            this.tokens = tokenize(expression);
        }

        AttributeNode parseExpression() throws QueryCompileException {
            if (tokens.isEmpty()) {
                throw error("empty expression");
            }
            AttributeNode node = parseOr();
            if (position < tokens.size()) {
                throw error("unexpected '" + tokens.get(position) + "'");
            }
            return node;
        }

        private AttributeNode parseOr() throws QueryCompileException {
            List<AttributeNode> children = new ArrayList<>();
            children.add(parseAnd());
            while (acceptKeyword("or")) {
                children.add(parseAnd());
            }
            return children.size() == 1 ? children.get(0) : new AttributeNode.Or(children);
        }

        private AttributeNode parseAnd() throws QueryCompileException {
            List<AttributeNode> children = new ArrayList<>();
            children.add(parseUnary());
            while (acceptKeyword("and")) {
                children.add(parseUnary());
            }
            return children.size() == 1 ? children.get(0) : new AttributeNode.And(children);
        }

        private AttributeNode parseUnary() throws QueryCompileException {
            if (acceptKeyword("not")) {
                return new AttributeNode.Not(parseUnary());
            }
            return parsePrimary();
        }

        private AttributeNode parsePrimary() throws QueryCompileException {
            if (accept("(")) {
                AttributeNode node = parseOr();
                expect(")");
                return node;
            }
            String token = next();
            String keyword = token.toLowerCase(Locale.ROOT);
            if ((keyword.equals("any") || keyword.equals("all")) && accept("(")) {
                List<AttributeNode> children = new ArrayList<>();
                children.add(literal(next()));
                while (accept(",")) {
                    children.add(literal(next()));
                }
                expect(")");
                if (children.size() == 1) {
                    return children.get(0);
                }
                return keyword.equals("any") ? new AttributeNode.Or(children) : new AttributeNode.And(children);
            }
            return literal(token);
        }

        private AttributeNode literal(String name) throws QueryCompileException {
            if (isPunctuation(name) || isKeyword(name)) {
                throw error("expected a value but found '" + name + "'");
            }
            Integer mask = vocabulary.lookup(name).orElseThrow(() -> error("unknown value '" + name + "'"));
            return new AttributeNode.Literal(name.toLowerCase(Locale.ROOT), mask);
        }

        private String next() throws QueryCompileException {
            if (position >= tokens.size()) {
                throw error("unexpected end of expression");
            }
            return tokens.get(position++);
        }

        private boolean accept(String punctuation) {
            if (position < tokens.size() && tokens.get(position).equals(punctuation)) {
                position++;
                return true;
            }
            return false;
        }

        private boolean acceptKeyword(String keyword) {
            if (position < tokens.size() && tokens.get(position).equalsIgnoreCase(keyword)) {
                position++;
                return true;
            }
            return false;
        }

        private void expect(String punctuation) throws QueryCompileException {
            if (!accept(punctuation)) {
                throw error("expected '" + punctuation + "'");
            }
        }

        private QueryCompileException error(String problem) {
            return new QueryCompileException(field, problem + " in \"" + expression + "\"");
        }

        private List<String> tokenize(String expression) throws QueryCompileException {
            List<String> result = new ArrayList<>();
            int i = 0;
            while (i < expression.length()) {
                char c = expression.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                } else if (isPunctuation(String.valueOf(c))) {
                    result.add(String.valueOf(c));
                    i++;
                } else if (isNameChar(c)) {
                    int start = i;
                    while (i < expression.length() && isNameChar(expression.charAt(i))) {
                        i++;
                    }
                    result.add(expression.substring(start, i));
                } else {
                    throw error("unexpected character '" + c + "'");
                }
            }
            return result;
        }
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '+';
    }

    private static boolean isPunctuation(String token) {
        return token.equals("(") || token.equals(")") || token.equals(",");
    }

    private static boolean isKeyword(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        return lower.equals("and") || lower.equals("or") || lower.equals("not");
    }
}
