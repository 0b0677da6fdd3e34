package com.switchboard.dispatch.cli;

import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.registry.ModelRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: switchboard models
 */
@Command(name = "models", mixinStandardHelpOptions = true, description = "List the model registry in priority order")
@Component
public class ModelsCommand implements Runnable {

    private final ModelRegistry modelRegistry;

    public ModelsCommand(ModelRegistry modelRegistry) {
        this.modelRegistry = modelRegistry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        for (ModelSpec model : modelRegistry.models()) {
            ConsoleOutput.model(model);
        }
        ConsoleOutput.rule();
        ConsoleOutput.info(modelRegistry.models().size() + " models, up to "
                + modelRegistry.maxFallbacks() + " fallbacks per request");
    }
}
