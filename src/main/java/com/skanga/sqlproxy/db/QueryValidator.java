package com.skanga.sqlproxy.db;

import com.skanga.sqlproxy.config.ResourceManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lexical gate that only lets single, non-mutating read statements through.
 *
 * <p>Comments, string literals, quoted identifiers and dollar-quoted bodies are blanked out first,
 * so text inside them can neither trigger nor hide a match. Constructs whose extent differs between
 * PostgreSQL and H2 are rejected outright. The remaining text must then:
 * <ul>
 *   <li>start with {@code SELECT} or {@code WITH} (leading parentheses allowed),</li>
 *   <li>contain no statement separator other than one trailing semicolon,</li>
 *   <li>contain no blacklisted keyword as a whole word.</li>
 * </ul>
 * Word matching is case-insensitive and respects identifier boundaries, so {@code created_at}
 * or {@code updated_by} never match {@code CREATE} or {@code UPDATE}.
 *
 * <p>Instances are immutable and thread-safe; {@link #validate(String)} has no side effects.
 */
public class QueryValidator {
    public static final List<String> FORBIDDEN_KEYWORDS = List.of(
            "INSERT", "UPDATE", "DELETE", "DROP", "TRUNCATE", "ALTER", "CREATE", "GRANT", "REVOKE");

    private static final Pattern LEADING_WORD = Pattern.compile("^[\\s(]*([\\p{L}_][\\p{L}\\p{N}_]*)");
    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*$");
    private static final String WORD_CHAR = "[\\p{L}\\p{N}_$]";

    private final List<String> forbiddenKeywords;
    private final Pattern forbiddenPattern;
    private final int maxSqlLength;

    /**
     * Creates a validator with the built-in blacklist and no length limit.
     */
    public QueryValidator() {
        this(List.of(), Integer.MAX_VALUE);
    }

    /**
     * Creates a validator whose blacklist is the built-in one plus the given extensions.
     *
     * @param extraKeywords Additional keywords to reject, matched as whole words
     * @param maxSqlLength  Longest accepted query text in characters
     */
    public QueryValidator(Collection<String> extraKeywords, int maxSqlLength) {
        List<String> allKeywords = new ArrayList<>(FORBIDDEN_KEYWORDS);
        for (String extraKeyword : extraKeywords) {
            String normalized = extraKeyword.trim().toUpperCase(Locale.ROOT);
            if (!normalized.isEmpty() && !allKeywords.contains(normalized)) {
                allKeywords.add(normalized);
            }
        }
        this.forbiddenKeywords = List.copyOf(allKeywords);
        this.forbiddenPattern = Pattern.compile(
                "(?<!" + WORD_CHAR + ")(" + allKeywords.stream().map(Pattern::quote).collect(Collectors.joining("|"))
                        + ")(?!" + WORD_CHAR + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.maxSqlLength = maxSqlLength;
    }

    public List<String> getForbiddenKeywords() {
        return forbiddenKeywords;
    }

    /**
     * Decides whether the query text may be executed.
     *
     * @param sqlText The query text as submitted by the caller
     * @return Accepted, or Rejected with the first violation found
     */
    public ValidationVerdict validate(String sqlText) {
        if (sqlText == null || sqlText.isBlank()) {
            return ValidationVerdict.reject(ResourceManager.getErrorMessage("sql.validation.empty"));
        }
        if (sqlText.length() > maxSqlLength) {
            return ValidationVerdict.reject(ResourceManager.getErrorMessage("sql.validation.too.long", maxSqlLength));
        }

        String scannableSql;
        try {
            scannableSql = stripCommentsAndLiterals(sqlText).trim();
        } catch (IllegalArgumentException e) {
            return ValidationVerdict.reject(e.getMessage());
        }
        if (scannableSql.isEmpty()) {
            return ValidationVerdict.reject(ResourceManager.getErrorMessage("sql.validation.empty"));
        }

        Matcher leadingWord = LEADING_WORD.matcher(scannableSql);
        String statementType = leadingWord.find() ? leadingWord.group(1).toUpperCase(Locale.ROOT) : "";
        if (!statementType.equals("SELECT") && !statementType.equals("WITH")) {
            return ValidationVerdict.reject(ResourceManager.getErrorMessage("sql.validation.not.read"));
        }

        if (TRAILING_SEMICOLON.matcher(scannableSql).replaceFirst("").contains(";")) {
            return ValidationVerdict.reject(ResourceManager.getErrorMessage("sql.validation.multiple.statements"));
        }

        Matcher forbiddenMatch = forbiddenPattern.matcher(scannableSql);
        if (forbiddenMatch.find()) {
            return ValidationVerdict.reject(ResourceManager.getErrorMessage(
                    "sql.validation.forbidden.keyword", forbiddenMatch.group(1).toLowerCase(Locale.ROOT)));
        }

        return ValidationVerdict.accept();
    }

    /**
     * Replaces comments with a space and empties the contents of string literals, quoted identifiers
     * and dollar-quoted bodies, keeping their delimiters.
     *
     * <p>Text that PostgreSQL and H2 would split differently is refused rather than guessed at:
     * unterminated constructs, {@code //} comments, nested block comments, {@code \'} inside
     * {@code E'...'} strings and tagged dollar-quoted bodies holding separators, quotes or comments.
     *
     * @param sqlText Raw query text
     * @return Text containing only SQL tokens outside of literals and comments
     * @throws IllegalArgumentException with the rejection reason if the text cannot be scanned safely
     */
    static String stripCommentsAndLiterals(String sqlText) {
        StringBuilder scannable = new StringBuilder(sqlText.length());
        int textLength = sqlText.length();
        int pos = 0;

        while (pos < textLength) {
            char currChar = sqlText.charAt(pos);
            char nextChar = pos + 1 < textLength ? sqlText.charAt(pos + 1) : '\0';

            if (currChar == '-' && nextChar == '-') {
                pos = skipLineComment(sqlText, pos);
                scannable.append(' ');
            } else if (currChar == '/' && nextChar == '/') {
                throw unsupportedSyntax("//");
            } else if (currChar == '/' && nextChar == '*') {
                pos = skipBlockComment(sqlText, pos);
                scannable.append(' ');
            } else if (currChar == '\'') {
                boolean backslashEscapes = isEscapeStringPrefix(sqlText, pos);
                pos = skipQuoted(sqlText, pos, '\'', backslashEscapes);
                scannable.append("''");
            } else if (currChar == '"') {
                pos = skipQuoted(sqlText, pos, currChar, false);
                scannable.append(currChar).append(currChar);
            } else if (currChar == '$' && isDollarQuoteStart(sqlText, pos)) {
                String dollarTag = sqlText.substring(pos, sqlText.indexOf('$', pos + 1) + 1);
                int bodyEnd = sqlText.indexOf(dollarTag, pos + dollarTag.length());
                if (bodyEnd < 0) {
                    throw unterminated();
                }
                // H2 only knows $$, so a tagged body is plain SQL there
                if (dollarTag.length() > 2 && !isInertBody(sqlText.substring(pos + dollarTag.length(), bodyEnd))) {
                    throw unsupportedSyntax(dollarTag);
                }
                pos = bodyEnd + dollarTag.length();
                scannable.append("''");
            } else {
                scannable.append(currChar);
                pos++;
            }
        }
        return scannable.toString();
    }

    // Both PostgreSQL and H2 end a line comment at either CR or LF.
    private static int skipLineComment(String sqlText, int startPos) {
        int pos = startPos + 2;
        while (pos < sqlText.length()) {
            char currChar = sqlText.charAt(pos);
            if (currChar == '\n' || currChar == '\r') {
                return pos;
            }
            pos++;
        }
        return pos;
    }

    // PostgreSQL nests block comments and H2 does not, so nesting is refused.
    private static int skipBlockComment(String sqlText, int startPos) {
        int closePos = sqlText.indexOf("*/", startPos + 2);
        if (closePos < 0) {
            throw unterminated();
        }
        if (sqlText.substring(startPos + 2, closePos).contains("/*")) {
            throw unsupportedSyntax("/* /*");
        }
        return closePos + 2;
    }

    // A doubled delimiter inside the quotes is an escaped delimiter.
    private static int skipQuoted(String sqlText, int startPos, char delimiter, boolean backslashEscapes) {
        int pos = startPos + 1;
        while (pos < sqlText.length()) {
            char currChar = sqlText.charAt(pos);
            if (backslashEscapes && currChar == '\\') {
                if (pos + 1 < sqlText.length() && sqlText.charAt(pos + 1) == delimiter) {
                    throw unsupportedSyntax("\\" + delimiter);
                }
                pos += 2;
            } else if (currChar == delimiter) {
                if (pos + 1 < sqlText.length() && sqlText.charAt(pos + 1) == delimiter) {
                    pos += 2;
                } else {
                    return pos + 1;
                }
            } else {
                pos++;
            }
        }
        throw unterminated();
    }

    private static boolean isInertBody(String dollarBody) {
        return dollarBody.chars().noneMatch(bodyChar -> bodyChar == ';' || bodyChar == '\'' || bodyChar == '"')
                && !dollarBody.contains("--") && !dollarBody.contains("/*");
    }

    private static IllegalArgumentException unterminated() {
        return new IllegalArgumentException(ResourceManager.getErrorMessage("sql.validation.unterminated"));
    }

    private static IllegalArgumentException unsupportedSyntax(String token) {
        return new IllegalArgumentException(ResourceManager.getErrorMessage("sql.validation.unsupported.syntax", token));
    }

    // E'...' strings treat backslash as an escape character.
    private static boolean isEscapeStringPrefix(String sqlText, int quotePos) {
        if (quotePos < 1 || Character.toUpperCase(sqlText.charAt(quotePos - 1)) != 'E') {
            return false;
        }
        return quotePos < 2 || !isWordChar(sqlText.charAt(quotePos - 2));
    }

    private static boolean isWordChar(char candidate) {
        return Character.isLetterOrDigit(candidate) || candidate == '_' || candidate == '$';
    }

    // $$ or $tag$ opens a dollar-quoted body; $1 is a positional parameter.
    private static boolean isDollarQuoteStart(String sqlText, int pos) {
        if (pos > 0 && isWordChar(sqlText.charAt(pos - 1))) {
            return false;
        }
        int tagEnd = sqlText.indexOf('$', pos + 1);
        if (tagEnd < 0) {
            return false;
        }
        String dollarTag = sqlText.substring(pos + 1, tagEnd);
        return dollarTag.isEmpty() || dollarTag.matches("[\\p{L}_][\\p{L}\\p{N}_]*");
    }
}
