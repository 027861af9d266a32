package io.switchboard.cli;

import io.switchboard.core.registry.FileModelRegistry;
import io.switchboard.core.registry.ModelConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "models", description = "List, add or remove registered models")
public final class ModelsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--add", description = "JSON file with one model definition to add or replace")
    Path add;

    @Option(names = "--remove", description = "Id of the model to remove (deactivated if it has traffic)")
    String remove;

    public ModelsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        FileModelRegistry registry = context.registry();
        try {
            if (add != null) {
                ModelConfig saved = registry.save(registry.readModel(Files.readString(add)));
                System.out.println("Saved model " + saved.id() + " (" + saved.key() + ")");
                return 0;
            }
            if (remove != null) {
                if (!registry.remove(remove)) {
                    System.err.println("Unknown model id: " + remove);
                    return 1;
                }
                System.out.println("Removed model " + remove);
                return 0;
            }
            List<ModelConfig> models = registry.list();
            if (models.isEmpty()) {
                System.out.println("No models registered in " + registry.path());
                return 0;
            }
            for (ModelConfig model : models) {
                System.out.printf(
                    "%-24s %-32s priority=%-3d %-8s tasks=%s capabilities=%s%n",
                    model.id(),
                    model.key(),
                    model.priority(),
                    model.active() ? "active" : "inactive",
                    model.supportedTasks().isEmpty() ? "any" : joined(model.supportedTasks()),
                    joined(model.capabilities())
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Models command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String joined(Collection<? extends Enum<?>> values) {
        return values.stream().map(Enum::name).sorted().collect(Collectors.joining(","));
    }
}
