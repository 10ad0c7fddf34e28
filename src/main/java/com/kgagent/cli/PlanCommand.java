package com.kgagent.cli;

import static com.kgagent.cli.ui.AnsiJson.ANSI_CYAN;
import static com.kgagent.cli.ui.AnsiJson.ANSI_PURPLE;
import static com.kgagent.cli.ui.AnsiJson.ANSI_RED;
import static com.kgagent.cli.ui.AnsiJson.ANSI_RESET;
import static com.kgagent.cli.ui.AnsiJson.ANSI_YELLOW;

import com.kgagent.cli.ui.AnsiJson;
import com.kgagent.cli.ui.Spinner;
import com.kgagent.dto.request.PlanRunOptions;
import com.kgagent.dto.response.CommandResponse;
import com.kgagent.model.CancellationToken;
import com.kgagent.model.PlanExecutionResult;
import com.kgagent.model.PlanOutcome;
import com.kgagent.model.QueryPlan;
import com.kgagent.model.QueryStep;
import com.kgagent.model.SparqlResult;
import com.kgagent.service.api.ContextPackService;
import com.kgagent.service.api.GxaBridgeService;
import com.kgagent.service.api.PlanBuilder;
import com.kgagent.service.api.StepExecutor;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import org.jline.reader.LineReader;
import org.springframework.context.annotation.Lazy;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Runs the drug to disease to datasets plan across Wikidata and NDE.
 */
@ShellComponent
public class PlanCommand {

    private final PlanBuilder planBuilder;
    private final StepExecutor stepExecutor;
    private final GxaBridgeService gxaBridge;
    private final ContextPackService contextPackService;
    private final LineReader lineReader;
    private final Spinner spinner;

    public PlanCommand(PlanBuilder planBuilder, StepExecutor stepExecutor, GxaBridgeService gxaBridge,
                       ContextPackService contextPackService, @Lazy LineReader lineReader, Spinner spinner) {
        this.planBuilder = planBuilder;
        this.stepExecutor = stepExecutor;
        this.gxaBridge = gxaBridge;
        this.contextPackService = contextPackService;
        this.lineReader = lineReader;
        this.spinner = spinner;
    }

    @ShellMethod(key = "plan-drug-datasets", value = "Find datasets about the diseases a drug treats.")
    public void planDrugDatasets(
            @ShellOption(value = {"--drugs"}, help = "Comma-separated drug names, e.g. methotrexate.") String drugs,
            @ShellOption(value = "--geo-only", help = "Only NCBI GEO datasets.", defaultValue = "false", arity = 0) boolean geoOnly,
            @ShellOption(value = "--max-results", help = "Maximum datasets (capped at 500).", defaultValue = ShellOption.NULL) Integer maxResults,
            @ShellOption(value = "--gxa-bridge", help = "Flag datasets that have Expression Atlas experiments.", defaultValue = "false", arity = 0) boolean gxaBridgeEnabled,
            @ShellOption(value = {"--debug", "-d"}, help = "Show the executed query of every step.", defaultValue = "false", arity = 0) boolean debug,
            @ShellOption(value = "--no-repair", help = "Do not repair rejected queries.", defaultValue = "false", arity = 0) boolean noRepair,
            @ShellOption(value = {"--pack", "-p"}, help = "Context pack id.", defaultValue = ShellOption.NULL) String packId
    ) {
        try {
            List<String> names = Arrays.stream(drugs.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
            QueryPlan plan = planBuilder.buildDrugDatasetsPlan(names, maxResults, geoOnly);

            System.out.println("\nI have built the following plan (" + plan.getId() + "):");
            plan.getSteps().forEach(step -> System.out.println(ANSI_YELLOW + "  " + step.getId() + ". " + step.getDescription()
                    + (step.getDependsOn().isEmpty() ? "" : "  [after " + String.join(", ", step.getDependsOn()) + "]") + ANSI_RESET));

            String confirmation = lineReader.readLine(ANSI_CYAN + "Execute this plan? [y/N]: " + ANSI_RESET);
            if (confirmation == null || !"y".equalsIgnoreCase(confirmation.trim())) {
                System.out.println("Execution cancelled.");
                return;
            }

            System.out.println("Executing plan...");
            PlanRunOptions options = new PlanRunOptions(packId, debug, !noRepair);
            CancellationToken cancellation = CancellationToken.create();
            PlanExecutionResult result = spinner.spin("Running plan...",
                    () -> stepExecutor.execute(plan, options, cancellation), cancellation);
            printResult(plan, result, debug);

            String last = plan.getSteps().get(plan.getSteps().size() - 1).getId();
            SparqlResult datasets = result.results().get(last);
            if (datasets == null) {
                return;
            }
            if (gxaBridgeEnabled && datasets.size() > 0) {
                datasets = spinner.spin("Checking Expression Atlas...",
                        () -> gxaBridge.annotate(result.results().get(last), contextPackService.getPack(packId)));
            }
            System.out.println(AnsiJson.format(QueryCommand.rowsAsJson(datasets)));
        } catch (CancellationException e) {
            System.out.println(ANSI_PURPLE + "Plan cancelled by the user." + ANSI_RESET);
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString());
        }
    }

    private static void printResult(QueryPlan plan, PlanExecutionResult result, boolean debug) {
        for (QueryStep step : plan.getSteps()) {
            String id = step.getId();
            if (result.results().containsKey(id)) {
                System.out.println("  " + id + ": " + step.getStatus() + " (" + result.results().get(id).size() + " row(s))");
            } else if (result.failures().containsKey(id)) {
                System.out.println(ANSI_RED + "  " + id + ": FAILED - " + result.failures().get(id) + ANSI_RESET);
            } else if (result.skippedStepIds().contains(id)) {
                System.out.println(ANSI_PURPLE + "  " + id + ": skipped (an upstream step did not complete)" + ANSI_RESET);
            }
            if (debug && result.executedQueries().containsKey(id)) {
                System.out.println(ANSI_PURPLE + result.executedQueries().get(id) + ANSI_RESET);
            }
        }
        boolean ok = result.outcome() == PlanOutcome.DONE;
        System.out.println(new CommandResponse(ok, "Plan " + result.planId() + " finished: " + result.outcome()).toAnsiString());
    }
}
