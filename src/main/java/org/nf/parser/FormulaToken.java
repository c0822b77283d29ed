package org.nf.parser;

import org.nf.antlr.LogicFormulaLexer;

/**
 * TOKEN - Unità lessicale immutabile di una formula
 *
 * Prodotto una sola volta dal tokenizer e consumato una sola volta dal parser.
 * Conserva il testo esatto e l'offset nel testo di input, usato per la
 * segnalazione degli errori.
 */
public final class FormulaToken {

    /**
     * Categorie lessicali, con il corrispondente tipo di token della grammatica ANTLR.
     */
    public enum Kind {
        TERM(LogicFormulaLexer.TERM),
        AND(LogicFormulaLexer.AND),
        OR(LogicFormulaLexer.OR),
        NOT(LogicFormulaLexer.NOT),
        LPAREN(LogicFormulaLexer.LPAR),
        RPAREN(LogicFormulaLexer.RPAR),
        IMPLIES(LogicFormulaLexer.IMPLIES);

        private final int antlrType;

        Kind(int antlrType) {
            this.antlrType = antlrType;
        }

        public int antlrType() {
            return antlrType;
        }

        /**
         * Operatori binari: richiedono un operando a sinistra e uno a destra.
         */
        public boolean isBinaryOperator() {
            return this == AND || this == OR || this == IMPLIES;
        }

        /**
         * @throws IllegalArgumentException se il tipo ANTLR non corrisponde a nessuna categoria
         */
        public static Kind fromAntlrType(int antlrType) {
            for (Kind kind : values()) {
                if (kind.antlrType == antlrType) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Tipo di token ANTLR non supportato: " + antlrType);
        }
    }

    private final Kind kind;
    private final String text;
    private final int position;

    public FormulaToken(Kind kind, String text, int position) {
        if (kind == null || text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Token richiede tipo e testo non vuoto");
        }
        if (position < 0) {
            throw new IllegalArgumentException("Posizione del token non può essere negativa: " + position);
        }
        this.kind = kind;
        this.text = text;
        this.position = position;
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    /**
     * @return offset (0-based) del primo carattere del token nel testo di input
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return offset del primo carattere dopo il token
     */
    public int getEndPosition() {
        return position + text.length();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        FormulaToken other = (FormulaToken) obj;
        return kind == other.kind && position == other.position && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * kind.hashCode() + text.hashCode()) + position;
    }

    @Override
    public String toString() {
        return kind == Kind.TERM ? "TERM(" + text + ")@" + position : kind + "@" + position;
    }
}
