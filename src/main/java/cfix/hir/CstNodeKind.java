package cfix.hir;

/** Semantic class of a {@link CstNode}. */
public enum CstNodeKind {
    STRUCT,
    ENUM,
    UNION,
    FUNCTION,
    COMMENT,
    MACRO,
    OTHER,
    UNKNOWN;

    /** Maps an aggregate keyword to its node kind. */
    public static CstNodeKind forAggregate(TokenKind keyword) {
        switch (keyword) {
        case KEYWORD_STRUCT:
            return STRUCT;
        case KEYWORD_UNION:
            return UNION;
        case KEYWORD_ENUM:
            return ENUM;
        default:
            throw new IllegalArgumentException("not an aggregate keyword: " +
                    keyword);
        }
    }
}
