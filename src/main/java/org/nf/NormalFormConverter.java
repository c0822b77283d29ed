package org.nf;

import org.nf.expression.Expression;
import org.nf.expression.NormalForm;
import org.nf.parser.FormulaParser;
import org.nf.parser.FormulaTokenizer;
import org.nf.parser.FormulaToken;
import org.nf.render.FormulaRenderer;
import org.nf.transform.ClauseDistributor;
import org.nf.transform.ClauseSimplifier;
import org.nf.transform.NegationNormalizer;

import java.util.List;
import java.util.logging.Logger;

/**
 * CONVERTITORE IN FORMA NORMALE - Pipeline completa da testo a testo
 *
 * PIPELINE TRASFORMAZIONE:
 * 1. Tokenizzazione del testo
 * 2. Parsing con precedenze ~, &&, ||, => (dalla più forte alla più debole)
 * 3. Eliminazione implicazioni e normalizzazione negazioni (NNF)
 * 4. Distribuzione verso CNF o DNF
 * 5. Semplificazione locale (ed eventuale sussunzione)
 * 6. Rappresentazione testuale, con ogni clausola di più letterali tra parentesi
 *
 * Ogni fase è una funzione pura su alberi immutabili: un'istanza può essere
 * riutilizzata per più conversioni.
 */
public class NormalFormConverter {

    private static final Logger LOGGER = Logger.getLogger(NormalFormConverter.class.getName());

    private final boolean useSubsumption;

    public NormalFormConverter() {
        this(false);
    }

    /**
     * @param useSubsumption true per eliminare le clausole sussunte da altre
     */
    public NormalFormConverter(boolean useSubsumption) {
        this.useSubsumption = useSubsumption;
    }

    /**
     * Converte il testo di una formula nella forma normale richiesta.
     *
     * @param input testo della formula
     * @param form forma di destinazione
     * @return formula semplificata in forma testuale
     * @throws org.nf.parser.FormulaLexException se il testo è vuoto
     * @throws org.nf.parser.FormulaParseException se la formula è malformata
     */
    public String convert(String input, NormalForm form) {
        LOGGER.fine("Inizio conversione " + form + " per: " + input);

        List<FormulaToken> tokens = FormulaTokenizer.tokenize(input);
        Expression parsed = FormulaParser.parse(tokens);
        String output = FormulaRenderer.renderGrouped(convert(parsed, form));

        LOGGER.fine("Conversione " + form + " completata: " + output);
        return output;
    }

    /**
     * Converte un albero (anche con implicazioni) nella forma normale richiesta.
     */
    public Expression convert(Expression parsed, NormalForm form) {
        Expression nnf = NegationNormalizer.toNNF(parsed);
        Expression distributed = ClauseDistributor.distribute(nnf, form);
        return new ClauseSimplifier(useSubsumption).simplify(distributed, form);
    }

    public boolean isUsingSubsumption() {
        return useSubsumption;
    }
}
