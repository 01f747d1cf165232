package cfix.hir;

import java.util.HashMap;
import java.util.Map;

/**
 * Lexical classes produced by the tokenizer. Keywords carry their spelling so
 * that the tokenizer can look them up; every other kind has a null spelling.
 */
public enum TokenKind {

    // punctuators
    LBRACE, RBRACE, LBRACKET, RBRACKET, LPAREN, RPAREN,
    SEMICOLON, COMMA, COLON, QUESTION, TILDE,
    DOT, ELLIPSIS, ARROW,
    ASSIGN, EQ, NOT, NE,
    PLUS, INCREMENT, PLUS_ASSIGN,
    MINUS, DECREMENT, MINUS_ASSIGN,
    STAR, MUL_ASSIGN,
    SLASH, DIV_ASSIGN,
    PERCENT, MOD_ASSIGN,
    LT, LE, LSHIFT, LSHIFT_ASSIGN,
    GT, GE, RSHIFT, RSHIFT_ASSIGN,
    AMPERSAND, LOGICAL_AND, AND_ASSIGN,
    PIPE, LOGICAL_OR, OR_ASSIGN,
    CARET, XOR_ASSIGN,
    HASH, HASH_HASH,

    // literals and names
    IDENTIFIER, NUMBER_LITERAL, STRING_LITERAL, CHAR_LITERAL,

    // C89
    KEYWORD_AUTO("auto"), KEYWORD_BREAK("break"), KEYWORD_CASE("case"),
    KEYWORD_CHAR("char"), KEYWORD_CONST("const"), KEYWORD_CONTINUE("continue"),
    KEYWORD_DEFAULT("default"), KEYWORD_DO("do"), KEYWORD_DOUBLE("double"),
    KEYWORD_ELSE("else"), KEYWORD_ENUM("enum"), KEYWORD_EXTERN("extern"),
    KEYWORD_FLOAT("float"), KEYWORD_FOR("for"), KEYWORD_GOTO("goto"),
    KEYWORD_IF("if"), KEYWORD_INT("int"), KEYWORD_LONG("long"),
    KEYWORD_REGISTER("register"), KEYWORD_RETURN("return"),
    KEYWORD_SHORT("short"), KEYWORD_SIGNED("signed"),
    KEYWORD_SIZEOF("sizeof"), KEYWORD_STATIC("static"),
    KEYWORD_STRUCT("struct"), KEYWORD_SWITCH("switch"),
    KEYWORD_TYPEDEF("typedef"), KEYWORD_UNION("union"),
    KEYWORD_UNSIGNED("unsigned"), KEYWORD_VOID("void"),
    KEYWORD_VOLATILE("volatile"), KEYWORD_WHILE("while"),
    // C99
    KEYWORD_INLINE("inline"), KEYWORD_RESTRICT("restrict"),
    KEYWORD_BOOL("_Bool"), KEYWORD_COMPLEX("_Complex"),
    KEYWORD_IMAGINARY("_Imaginary"),
    // C11
    KEYWORD_ALIGNAS("_Alignas"), KEYWORD_ALIGNOF("_Alignof"),
    KEYWORD_ATOMIC("_Atomic"), KEYWORD_GENERIC("_Generic"),
    KEYWORD_NORETURN("_Noreturn"), KEYWORD_STATIC_ASSERT("_Static_assert"),
    KEYWORD_THREAD_LOCAL("_Thread_local"),
    // C23
    KEYWORD_ALIGNAS_C23("alignas"), KEYWORD_ALIGNOF_C23("alignof"),
    KEYWORD_BOOL_C23("bool"), KEYWORD_CONSTEXPR("constexpr"),
    KEYWORD_FALSE("false"), KEYWORD_NULLPTR("nullptr"),
    KEYWORD_STATIC_ASSERT_C23("static_assert"),
    KEYWORD_THREAD_LOCAL_C23("thread_local"), KEYWORD_TRUE("true"),
    KEYWORD_TYPEOF("typeof"), KEYWORD_TYPEOF_UNQUAL("typeof_unqual"),
    KEYWORD_BITINT("_BitInt"), KEYWORD_DECIMAL32("_Decimal32"),
    KEYWORD_DECIMAL64("_Decimal64"), KEYWORD_DECIMAL128("_Decimal128"),
    // extensions
    KEYWORD_GNU_INLINE("__inline"), KEYWORD_GNU_INLINE2("__inline__"),
    KEYWORD_GNU_RESTRICT("__restrict"), KEYWORD_GNU_RESTRICT2("__restrict__"),
    KEYWORD_GNU_TYPEOF("__typeof__"),
    // _Pragma operator
    KEYWORD_PRAGMA("_Pragma"),

    // trivia and catch-alls
    COMMENT, MACRO, WHITESPACE, OTHER;

    private static final Map<String, TokenKind> keywords =
            new HashMap<String, TokenKind>();

    static {
        for (TokenKind kind : values()) {
            if (kind.spelling != null) {
                keywords.put(kind.spelling, kind);
            }
        }
    }

    private final String spelling;

    TokenKind() {
        this(null);
    }

    TokenKind(String spelling) {
        this.spelling = spelling;
    }

    /**
    * Returns the keyword kind for the given spelling, or null if the word is
    * an ordinary identifier.
    */
    public static TokenKind lookupKeyword(String word) {
        return keywords.get(word);
    }

    /** Returns the keyword spelling, or null for non-keyword kinds. */
    public String getSpelling() {
        return spelling;
    }

    /** Whitespace and comments, which carry no syntax. */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }

    public boolean isAggregateKeyword() {
        return this == KEYWORD_STRUCT || this == KEYWORD_UNION ||
                this == KEYWORD_ENUM;
    }

    /** Storage-class and function specifiers that may prefix a declaration. */
    public boolean isStorageSpecifier() {
        switch (this) {
        case KEYWORD_STATIC:
        case KEYWORD_EXTERN:
        case KEYWORD_INLINE:
        case KEYWORD_NORETURN:
        case KEYWORD_THREAD_LOCAL:
        case KEYWORD_THREAD_LOCAL_C23:
        case KEYWORD_GNU_INLINE:
        case KEYWORD_GNU_INLINE2:
        case KEYWORD_AUTO:
        case KEYWORD_REGISTER:
        case KEYWORD_TYPEDEF:
        case KEYWORD_CONSTEXPR:
            return true;
        default:
            return false;
        }
    }

    /** Qualifiers that may follow a pointer star. */
    public boolean isQualifier() {
        switch (this) {
        case KEYWORD_CONST:
        case KEYWORD_VOLATILE:
        case KEYWORD_RESTRICT:
        case KEYWORD_ATOMIC:
        case KEYWORD_GNU_RESTRICT:
        case KEYWORD_GNU_RESTRICT2:
            return true;
        default:
            return false;
        }
    }

    /** Keywords that name (part of) a type. */
    public boolean isTypeSpecifier() {
        switch (this) {
        case KEYWORD_VOID:
        case KEYWORD_CHAR:
        case KEYWORD_SHORT:
        case KEYWORD_INT:
        case KEYWORD_LONG:
        case KEYWORD_FLOAT:
        case KEYWORD_DOUBLE:
        case KEYWORD_SIGNED:
        case KEYWORD_UNSIGNED:
        case KEYWORD_BOOL:
        case KEYWORD_BOOL_C23:
        case KEYWORD_COMPLEX:
        case KEYWORD_IMAGINARY:
        case KEYWORD_BITINT:
        case KEYWORD_DECIMAL32:
        case KEYWORD_DECIMAL64:
        case KEYWORD_DECIMAL128:
        case KEYWORD_STRUCT:
        case KEYWORD_UNION:
        case KEYWORD_ENUM:
        case KEYWORD_TYPEOF:
        case KEYWORD_TYPEOF_UNQUAL:
        case KEYWORD_GNU_TYPEOF:
            return true;
        default:
            return false;
        }
    }
}
