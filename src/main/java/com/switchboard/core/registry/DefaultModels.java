package com.switchboard.core.registry;

import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.model.TaskCategory;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static com.switchboard.core.model.TaskCategory.*;

/**
 * Built-in model catalogue used when no models are configured under
 * {@code switchboard.registry.models}.
 */
public final class DefaultModels {

    private DefaultModels() {}

    public static final List<ModelSpec> CATALOGUE = List.of(
            model("zai-org/GLM-4.7-Flash", "GLM 4.7 Flash",
                    Set.of(SIMPLE_TEXT, GENERAL_TEXT), 1, 4096, false, 30),
            model("zai-org/GLM-4.7-TEE", "GLM 4.7",
                    Set.of(GENERAL_TEXT, UNKNOWN), 2, 8192, false, 60),
            model("deepseek-ai/DeepSeek-V3.2-Speciale-TEE", "DeepSeek V3.2 Speciale",
                    Set.of(MATH_REASONING), 3, 16384, false, 120),
            model("MiniMaxAI/MiniMax-M2.1-TEE", "MiniMax M2.1",
                    Set.of(PROGRAMMING), 4, 16384, false, 90),
            model("deepseek-ai/DeepSeek-TNG-R1T2-Chimera", "TNG R1T2 Chimera",
                    Set.of(CREATIVE), 5, 16384, false, 90),
            model("Qwen/Qwen3-VL-235B-A22B-Instruct", "Qwen3 VL 235B",
                    Set.of(VISION), 6, 8192, true, 90),
            model("zai-org/GLM-4.6V", "GLM 4.6V",
                    Set.of(VISION), 7, 8192, true, 60),
            model("XiaomiMiMo/MiMo-V2-Flash", "MiMo V2 Flash",
                    Set.of(SIMPLE_TEXT, GENERAL_TEXT), 8, 4096, false, 30)
    );

    private static ModelSpec model(String id, String name, Set<TaskCategory> categories, int priority,
                                   int maxTokens, boolean vision, int timeoutSeconds) {
        return new ModelSpec(id, name, categories, priority, maxTokens, vision,
                Duration.ofSeconds(timeoutSeconds), 0.7, ModelSpec.DEFAULT_BACKEND);
    }
}
