package org.nf;

import org.nf.expression.NormalForm;
import org.nf.parser.FormulaLexException;
import org.nf.parser.FormulaParseException;
import org.nf.parser.FormulaSyntaxException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * CONVERTITORE IN FORMA NORMALE CONGIUNTIVA / DISGIUNTIVA
 *
 * Interfaccia a riga di comando: legge una formula proposizionale, la converte in
 * CNF (default) o DNF semplificata e stampa il risultato sullo standard output.
 *
 * UTILIZZO:
 *   java -jar convertitore-fn.jar &lt;formula&gt; [dnf|cnf] [-opt=s] [-v] [-h]
 *
 * CODICI DI USCITA:
 * - 0: conversione riuscita (o help mostrato)
 * - 1: formula malformata, diagnostica con posizione su standard error
 * - 2: parametri della riga di comando non validi
 *
 * @version 1.0.0
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    /** Logger radice del progetto, trattenuto per non perdere il livello impostato */
    private static final Logger PROJECT_LOGGER = Logger.getLogger("org.nf");

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     */
    private static final String HELP_PARAM = "-h";
    private static final String VERBOSE_PARAM = "-v";
    private static final String OPT_PARAM = "-opt=";
    private static final String DNF_MODE = "dnf";
    private static final String CNF_MODE = "cnf";

    /**
     * Flag ottimizzazioni disponibili
     */
    private static final char OPT_SUBSUMPTION = 's';

    static final int EXIT_OK = 0;
    static final int EXIT_SYNTAX_ERROR = 1;
    static final int EXIT_USAGE_ERROR = 2;

    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Esegue la conversione descritta dai parametri.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Conversione della formula nella forma richiesta
     * 3. Stampa del risultato oppure della diagnostica
     *
     * @param args parametri linea di comando
     * @param out destinazione del risultato
     * @param err destinazione della diagnostica
     * @return codice di uscita
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        ConverterConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            err.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            err.println("Usa -h per visualizzare l'help completo.");
            return EXIT_USAGE_ERROR;
        }

        if (config == null) {
            printApplicationHelp(out);
            return EXIT_OK;
        }

        if (config.verbose) {
            PROJECT_LOGGER.setLevel(Level.FINE);
        }

        try {
            NormalFormConverter converter = new NormalFormConverter(config.useSubsumption);
            out.println(converter.convert(config.sentence, config.form));
            return EXIT_OK;
        } catch (FormulaSyntaxException e) {
            err.println(describeSyntaxError(e));
            LOGGER.log(Level.FINE, "Conversione interrotta", e);
            return EXIT_SYNTAX_ERROR;
        }
    }

    /**
     * Compone il messaggio di errore per l'utente, con posizione quando nota.
     */
    static String describeSyntaxError(FormulaSyntaxException e) {
        StringBuilder message = new StringBuilder("[E] ");
        if (e instanceof FormulaParseException) {
            message.append("Errore di sintassi (").append(((FormulaParseException) e).getReason()).append(")");
        } else if (e instanceof FormulaLexException) {
            message.append("Errore lessicale");
        } else {
            message.append("Errore nella formula");
        }
        if (e.hasPosition()) {
            message.append(" alla posizione ").append(e.getPosition());
        }
        return message.append(": ").append(e.getMessage()).toString();
    }

    /**
     * Carica la configurazione di java.util.logging dal classpath.
     */
    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Configurazione logging non leggibile, uso quella di default", e);
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp(PrintStream out) {
        out.println("::>> CONVERTITORE IN FORMA NORMALE <<::");
        out.println("Converte formule proposizionali in CNF o DNF semplificata\n");

        out.println("UTILIZZO:");
        out.println("  java -jar convertitore-fn.jar <formula> [dnf|cnf] [opzioni]\n");

        out.println("PARAMETRI:");
        out.println("  <formula>       Formula da convertire (tra apici per preservare gli spazi)");
        out.println("  dnf | cnf       Forma di destinazione (default: cnf)");
        out.println("  -opt=s          Sussunzione (elimina clausole ridondanti)");
        out.println("  -v              Log dettagliato della pipeline su standard error");
        out.println("  -h              Mostra questa guida\n");

        out.println("SINTASSI (precedenza dalla più forte):");
        out.println("  ~ (NOT), && (AND), || (OR), => (IMPLIES, associativa a destra), ( )");
        out.println("  Ogni altra sequenza senza spazi è un termine\n");

        out.println("ESEMPI:");
        out.println("  java -jar convertitore-fn.jar 'a => b && ~c'");
        out.println("  java -jar convertitore-fn.jar 'a => b && c' dnf");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    static final class ConverterConfiguration {
        final String sentence;
        final NormalForm form;
        final boolean useSubsumption;
        final boolean verbose;

        ConverterConfiguration(String sentence, NormalForm form, boolean useSubsumption, boolean verbose) {
            this.sentence = sentence;
            this.form = form;
            this.useSubsumption = useSubsumption;
            this.verbose = verbose;
        }
    }

    /**
     * Parser dei parametri della riga di comando.
     */
    static final class ArgumentParser {

        /**
         * Processa i parametri: il primo argomento posizionale è la formula, il secondo
         * (facoltativo) la forma di destinazione.
         *
         * @return configurazione validata, oppure null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        ConverterConfiguration parse(String[] args) {
            String sentence = null;
            NormalForm form = null;
            boolean useSubsumption = false;
            boolean verbose = false;

            for (String arg : args) {
                if (HELP_PARAM.equals(arg)) {
                    return null;
                } else if (VERBOSE_PARAM.equals(arg)) {
                    verbose = true;
                } else if (arg.startsWith(OPT_PARAM)) {
                    useSubsumption = parseOptionalFlags(arg.substring(OPT_PARAM.length()));
                } else if (sentence == null) {
                    sentence = arg;
                } else if (form == null) {
                    form = parseForm(arg);
                } else {
                    throw new IllegalArgumentException("Parametro sconosciuto: " + arg);
                }
            }

            if (sentence == null) {
                throw new IllegalArgumentException("Nessuna formula fornita");
            }
            return new ConverterConfiguration(sentence, form == null ? NormalForm.CNF : form,
                    useSubsumption, verbose);
        }

        private NormalForm parseForm(String arg) {
            String mode = arg.toLowerCase(Locale.ROOT);
            if (DNF_MODE.equals(mode)) {
                return NormalForm.DNF;
            }
            if (CNF_MODE.equals(mode)) {
                return NormalForm.CNF;
            }
            throw new IllegalArgumentException("Forma non supportata: " + arg + " (valori ammessi: cnf, dnf)");
        }

        /**
         * @return true se è richiesta la sussunzione
         */
        private boolean parseOptionalFlags(String optValue) {
            if (optValue.isEmpty()) {
                throw new IllegalArgumentException("Valore -opt vuoto");
            }
            boolean subsumption = false;
            for (char flag : optValue.toCharArray()) {
                if (flag == OPT_SUBSUMPTION) {
                    subsumption = true;
                } else {
                    throw new IllegalArgumentException("Ottimizzazione sconosciuta: " + flag);
                }
            }
            return subsumption;
        }
    }

    //endregion
}
