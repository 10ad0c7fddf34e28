package com.kgagent.cli;

import static com.kgagent.cli.ui.AnsiJson.ANSI_CYAN;
import static com.kgagent.cli.ui.AnsiJson.ANSI_GREEN;
import static com.kgagent.cli.ui.AnsiJson.ANSI_PURPLE;
import static com.kgagent.cli.ui.AnsiJson.ANSI_RESET;
import static com.kgagent.cli.ui.AnsiJson.ANSI_YELLOW;

import com.kgagent.dto.response.CommandResponse;
import com.kgagent.model.ContextPack;
import com.kgagent.model.TaskDefinition;
import com.kgagent.service.api.ContextPackService;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Lists what a context pack can answer.
 */
@ShellComponent
public class TasksCommand {

    private final ContextPackService contextPackService;

    public TasksCommand(ContextPackService contextPackService) {
        this.contextPackService = contextPackService;
    }

    @ShellMethod(key = "tasks", value = "List the tasks and graphs of a context pack.")
    public void tasks(
            @ShellOption(value = {"--pack", "-p"}, help = "Context pack id.", defaultValue = ShellOption.NULL) String packId,
            @ShellOption(value = "--reload", help = "Reload packs from disk first.", defaultValue = "false", arity = 0) boolean reload
    ) {
        try {
            if (reload) {
                contextPackService.invalidateAll();
            }
            ContextPack pack = contextPackService.getPack(packId);
            System.out.println(ANSI_CYAN + "Context pack: " + ANSI_YELLOW + pack.getId()
                    + (pack.getLabel() == null ? "" : " (" + pack.getLabel() + ")") + ANSI_RESET);
            System.out.println("  Federation endpoint: " + pack.getFederationEndpoint());
            pack.getGraphs().forEach((name, graph) ->
                    System.out.println("  Graph " + ANSI_GREEN + name + ANSI_RESET + ": " + graph.getIri() + " -> " + graph.getEndpoint()));

            for (TaskDefinition task : pack.getTasks()) {
                System.out.println("-".repeat(50));
                System.out.println(ANSI_GREEN + "Task: " + ANSI_YELLOW + task.getId() + ANSI_RESET
                        + (task.isLlmAssistable() ? ANSI_PURPLE + "  [LLM-assisted]" + ANSI_RESET : ""));
                if (task.getDescription() != null) {
                    System.out.println("  " + task.getDescription());
                }
                System.out.println("  Required slots: " + task.getRequiredSlots());
                System.out.println("  Optional slots: " + task.getOptionalSlots());
                System.out.println("  Graphs: " + task.getDefaultGraphs() + " (" + task.getGraphMode() + ")");
            }
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString());
        }
    }
}
