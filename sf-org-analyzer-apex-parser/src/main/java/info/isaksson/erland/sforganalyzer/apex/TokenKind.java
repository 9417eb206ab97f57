package info.isaksson.erland.sforganalyzer.apex;

enum TokenKind {
    IDENTIFIER,
    NUMBER,
    /** Single-quoted literal; text is the unescaped content. */
    STRING,
    /** Inline query {@code [SELECT ...]}; text is the content between the brackets. */
    SOQL,
    /** {@code /** ... *}{@code /} comment; text is the cleaned comment body. */
    DOC_COMMENT,
    SYMBOL,
    EOF
}
