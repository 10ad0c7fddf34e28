package com.kgagent.cli;

import static com.kgagent.cli.ui.AnsiJson.ANSI_CYAN;
import static com.kgagent.cli.ui.AnsiJson.ANSI_PURPLE;
import static com.kgagent.cli.ui.AnsiJson.ANSI_RESET;
import static com.kgagent.cli.ui.AnsiJson.ANSI_YELLOW;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kgagent.cli.ui.AnsiJson;
import com.kgagent.cli.ui.Spinner;
import com.kgagent.dto.response.CommandResponse;
import com.kgagent.dto.response.ExecutionResponse;
import com.kgagent.model.CancellationToken;
import com.kgagent.model.ExecutionErrorKind;
import com.kgagent.model.Intent;
import com.kgagent.model.SparqlResult;
import com.kgagent.service.api.QueryService;
import java.util.Map;
import java.util.concurrent.CancellationException;
import org.jline.reader.LineReader;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Answers a one-step question: the question is interpreted and compiled, the user reviews the
 * intent and the query, and on confirmation the query runs against the knowledge graphs.
 */
@ShellComponent
public class QueryCommand {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final QueryService queryService;
    private final LineReader lineReader;
    private final Spinner spinner;

    public QueryCommand(QueryService queryService, @Lazy LineReader lineReader, Spinner spinner) {
        this.queryService = queryService;
        this.lineReader = lineReader;
        this.spinner = spinner;
    }

    /**
     * @param question the question, e.g. {@code Which genes are differentially expressed in E-GEOD-76?}
     * @param verbose  switch the root logger to DEBUG while the command runs.
     * @param debug    print the executed query and the endpoint it was sent to.
     * @param noRepair do not attempt to repair a query the endpoint rejects.
     * @param packId   context pack to use instead of the configured default.
     */
    @ShellMethod(key = "ask", value = "Ask a question of the biomedical knowledge graphs.")
    public void ask(
            @ShellOption(arity = Integer.MAX_VALUE, help = "The question.") String[] question,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose,
            @ShellOption(value = {"--debug", "-d"}, help = "Show the executed query and endpoint.", defaultValue = "false", arity = 0) boolean debug,
            @ShellOption(value = "--no-repair", help = "Do not repair rejected queries.", defaultValue = "false", arity = 0) boolean noRepair,
            @ShellOption(value = {"--pack", "-p"}, help = "Context pack id.", defaultValue = ShellOption.NULL) String packId
    ) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
            System.out.println(ANSI_PURPLE + "-- Verbose mode enabled --" + ANSI_RESET);
        }

        try {
            String text = String.join(" ", question);
            Intent intent = spinner.spin(() -> queryService.interpret(text, packId, Map.of()));
            String query = queryService.compile(intent);

            printIntent(intent);
            System.out.println(ANSI_CYAN + "\nCompiled query:" + ANSI_RESET);
            System.out.println(ANSI_YELLOW + query + ANSI_RESET);

            String confirmation = lineReader.readLine(ANSI_CYAN + "Execute this query? [y/N]: " + ANSI_RESET);
            if (confirmation == null || !"y".equalsIgnoreCase(confirmation.trim())) {
                System.out.println("Execution cancelled.");
                return;
            }

            System.out.println("Executing query...");
            CancellationToken cancellation = CancellationToken.create();
            ExecutionResponse response = spinner.spin("Querying...",
                    () -> queryService.run(intent, query, debug, !noRepair, cancellation), cancellation);
            printResponse(response, debug);
        } catch (CancellationException e) {
            System.out.println(ANSI_PURPLE + "Query cancelled by the user." + ANSI_RESET);
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString());
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
                System.out.println(ANSI_PURPLE + "-- Verbose mode disabled --" + ANSI_RESET);
            }
        }
    }

    private static void printIntent(Intent intent) {
        System.out.println("\nI interpreted the question as:");
        System.out.println(ANSI_YELLOW + "  task:       " + intent.getTask().getId() + ANSI_RESET);
        System.out.println(ANSI_YELLOW + "  confidence: " + String.format("%.2f", intent.getConfidence()) + ANSI_RESET);
        System.out.println(ANSI_YELLOW + "  graphs:     " + intent.getGraphs() + " (" + intent.getGraphMode() + ")" + ANSI_RESET);
        intent.getSlots().forEach((name, value) ->
                System.out.println(ANSI_YELLOW + "  " + name + " = " + (value.isList() ? value.asList() : value.asString()) + ANSI_RESET));
        if (intent.getNotes() != null && !intent.getNotes().isBlank()) {
            System.out.println(ANSI_PURPLE + "  notes: " + intent.getNotes() + ANSI_RESET);
        }
    }

    private static void printResponse(ExecutionResponse response, boolean debug) {
        if (debug && response.getEndpointUsed() != null) {
            System.out.println(ANSI_PURPLE + "Endpoint: " + response.getEndpointUsed() + ANSI_RESET);
        }
        if (debug && response.getExecutedQuery() != null) {
            System.out.println(ANSI_PURPLE + "Executed query:\n" + response.getExecutedQuery() + ANSI_RESET);
        }
        if (!response.isSuccess()) {
            String message = "Query failed: " + response.getError();
            if (response.getErrorKind() == ExecutionErrorKind.TIMEOUT) {
                message += "\nTry narrowing the question: fewer graphs, a more specific term or a smaller limit.";
            }
            System.out.println(new CommandResponse(false, message).toAnsiString());
            return;
        }
        if (response.isRepaired()) {
            System.out.println(ANSI_PURPLE + "-- The query was repaired before it succeeded --" + ANSI_RESET);
        }
        SparqlResult result = response.getResult();
        int rows = result == null ? 0 : result.size();
        System.out.println(new CommandResponse(true, rows + " row(s) in " + response.getElapsedMs() + " ms").toAnsiString());
        if (rows > 0) {
            System.out.println(AnsiJson.format(rowsAsJson(result)));
        }
    }

    /**
     * Flattens result rows to {@code {variable: value}} objects.
     */
    static ArrayNode rowsAsJson(SparqlResult result) {
        ArrayNode rows = MAPPER.createArrayNode();
        result.getBindings().forEach(binding -> {
            ObjectNode row = rows.addObject();
            result.getVars().forEach(var -> {
                if (binding.containsKey(var)) {
                    row.put(var, binding.get(var).getValue());
                }
            });
        });
        return rows;
    }
}
